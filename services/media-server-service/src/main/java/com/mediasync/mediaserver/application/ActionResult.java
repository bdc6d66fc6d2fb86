package com.mediasync.mediaserver.application;

import java.util.Map;

public record ActionResult(Status status, Object body, String message) {

    public enum Status {
        OK,
        INVALID_REQUEST,
        CONFIGURATION_ERROR,
        UPSTREAM_ERROR
    }

    public static ActionResult ok(Object body) {
        return new ActionResult(Status.OK, body, null);
    }

    public static ActionResult empty() {
        return new ActionResult(Status.OK, Map.of(), null);
    }

    public static ActionResult invalid(String message) {
        return new ActionResult(Status.INVALID_REQUEST, null, message);
    }

    public static ActionResult configurationError(String message) {
        return new ActionResult(Status.CONFIGURATION_ERROR, null, message);
    }

    public static ActionResult upstreamError(String message) {
        return new ActionResult(Status.UPSTREAM_ERROR, null, message);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
