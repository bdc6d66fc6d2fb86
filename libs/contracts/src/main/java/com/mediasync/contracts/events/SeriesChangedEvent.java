package com.mediasync.contracts.events;

import java.time.Instant;

public record SeriesChangedEvent(
        String eventId,
        ChangeType changeType,
        Integer seriesId,
        Integer tvdbId,
        String title,
        String path,
        Instant occurredAt
) {
    public enum ChangeType {
        DOWNLOAD,
        RENAME
    }
}
