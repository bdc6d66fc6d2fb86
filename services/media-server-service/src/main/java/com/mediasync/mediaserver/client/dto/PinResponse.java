package com.mediasync.mediaserver.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PinResponse(
        int id,
        String code,
        String authToken
) {
}
