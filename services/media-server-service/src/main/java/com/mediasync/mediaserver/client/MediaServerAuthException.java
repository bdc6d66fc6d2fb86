package com.mediasync.mediaserver.client;

public class MediaServerAuthException extends MediaServerException {
    public MediaServerAuthException(String message) {
        super(message);
    }

    public MediaServerAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
