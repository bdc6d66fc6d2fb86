package com.mediasync.mediaserver.api.dto;

import com.mediasync.mediaserver.application.ValidationFailure;

import java.util.List;

public record TestResponse(boolean valid, List<ValidationFailure> failures) {
}
