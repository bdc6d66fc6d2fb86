package com.mediasync.mediaserver.api.dto;

public record ErrorResponse(String error, String message) {
}
