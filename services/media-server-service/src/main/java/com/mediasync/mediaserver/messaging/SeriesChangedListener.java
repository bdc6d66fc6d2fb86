package com.mediasync.mediaserver.messaging;

import com.mediasync.contracts.Topics;
import com.mediasync.contracts.events.SeriesChangedEvent;
import com.mediasync.mediaserver.application.MediaServerNotifier;
import com.mediasync.mediaserver.domain.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "media-server.kafka", name = "enabled", havingValue = "true")
public class SeriesChangedListener {

    private static final Logger log = LoggerFactory.getLogger(SeriesChangedListener.class);

    private final MediaServerNotifier notifier;

    public SeriesChangedListener(MediaServerNotifier notifier) {
        this.notifier = notifier;
    }

    @KafkaListener(topics = Topics.SERIES_CHANGED, containerFactory = "seriesChangedListenerContainerFactory")
    public void onMessage(SeriesChangedEvent event) {
        if (event.changeType() == null) {
            throw new IllegalArgumentException("series changed event without changeType eventId=" + event.eventId());
        }
        if (event.seriesId() == null) {
            throw new IllegalArgumentException("series changed event without seriesId eventId=" + event.eventId());
        }
        Series series = new Series(event.seriesId(), event.tvdbId(), event.title(), event.path());
        switch (event.changeType()) {
            case DOWNLOAD -> notifier.onDownload(series);
            case RENAME -> notifier.onRename(series);
        }
        log.debug("Handled series change eventId={} type={} seriesId={}",
                event.eventId(), event.changeType(), event.seriesId());
    }
}
