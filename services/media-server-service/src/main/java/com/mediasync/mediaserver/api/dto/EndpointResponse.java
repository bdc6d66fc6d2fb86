package com.mediasync.mediaserver.api.dto;

public record EndpointResponse(
        String name,
        String key,
        String baseUrl,
        boolean updateLibrary,
        int pending,
        boolean draining
) {
}
