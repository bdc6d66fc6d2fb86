package com.mediasync.mediaserver.client.dto;

import java.util.Map;

/**
 * Describes the call a browser makes to create a sign-in PIN.
 */
public record PinRequest(
        String url,
        String method,
        Map<String, String> headers
) {
}
