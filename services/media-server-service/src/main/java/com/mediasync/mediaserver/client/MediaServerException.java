package com.mediasync.mediaserver.client;

public class MediaServerException extends RuntimeException {
    public MediaServerException(String message) {
        super(message);
    }

    public MediaServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
