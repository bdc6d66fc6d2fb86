package com.mediasync.mediaserver.application;

public record ValidationFailure(String field, String message) {
}
