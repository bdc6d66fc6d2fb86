package com.mediasync.mediaserver.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SeriesChangedRequest(
        @NotNull Integer seriesId,
        Integer tvdbId,
        @NotBlank String title,
        String path
) {
}
