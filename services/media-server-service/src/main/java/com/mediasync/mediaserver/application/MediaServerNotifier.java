package com.mediasync.mediaserver.application;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import com.mediasync.mediaserver.metrics.RefreshMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for series change notifications. Only queues; the refresh itself happens on the
 * next scheduled drain.
 */
@Service
public class MediaServerNotifier {

    private static final Logger log = LoggerFactory.getLogger(MediaServerNotifier.class);

    private final EndpointRegistry endpoints;
    private final CoalescingRefreshQueue<MediaServerEndpoint, Series> queue;
    private final RefreshMetrics metrics;

    public MediaServerNotifier(EndpointRegistry endpoints,
                               CoalescingRefreshQueue<MediaServerEndpoint, Series> queue,
                               RefreshMetrics metrics) {
        this.endpoints = endpoints;
        this.queue = queue;
        this.metrics = metrics;
    }

    public void onDownload(Series series) {
        updateIfEnabled(series);
    }

    public void onRename(Series series) {
        updateIfEnabled(series);
    }

    private void updateIfEnabled(Series series) {
        for (MediaServerEndpoint endpoint : endpoints.all()) {
            if (!endpoint.updateLibrary()) {
                continue;
            }
            queue.enqueue(endpoint, series);
            metrics.incEnqueued();
            log.debug("Queued library update endpoint={} seriesId={}", endpoint.name(), series.id());
        }
    }
}
