package com.mediasync.mediaserver.domain;

public record Series(
        int id,
        Integer tvdbId,
        String title,
        String path
) {
}
