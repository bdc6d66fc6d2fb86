package com.mediasync.mediaserver.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SectionsResponse(
        @JsonProperty("MediaContainer") Container container
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Container(
            @JsonProperty("Directory") List<Directory> directories
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Directory(
            String key,
            String type,
            String title,
            @JsonProperty("Location") List<Location> locations
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Location(
            long id,
            String path
    ) {
    }
}
