package com.mediasync.mediaserver.application;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.DrainResult;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import com.mediasync.mediaserver.metrics.RefreshMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class LibraryRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(LibraryRefreshScheduler.class);

    private final EndpointRegistry endpoints;
    private final CoalescingRefreshQueue<MediaServerEndpoint, Series> queue;
    private final RefreshMetrics metrics;

    public LibraryRefreshScheduler(EndpointRegistry endpoints,
                                   CoalescingRefreshQueue<MediaServerEndpoint, Series> queue,
                                   RefreshMetrics metrics) {
        this.endpoints = endpoints;
        this.queue = queue;
        this.metrics = metrics;
    }

    @Scheduled(initialDelayString = "${media-server.refresh.interval-ms:5000}",
            fixedDelayString = "${media-server.refresh.interval-ms:5000}")
    public void processQueues() {
        for (MediaServerEndpoint endpoint : endpoints.all()) {
            try {
                processQueue(endpoint);
            } catch (RuntimeException e) {
                // next tick retries whatever was queued after the failed batch
                log.warn("Library refresh failed endpoint={} key={}", endpoint.name(), endpoint.key(), e);
            }
        }
    }

    /**
     * Drains the endpoint's queue now. Sink failures are rethrown after being counted.
     */
    public DrainResult processQueue(MediaServerEndpoint endpoint) {
        DrainResult result;
        try {
            result = queue.drain(endpoint);
        } catch (RuntimeException e) {
            metrics.incFailure();
            throw e;
        }
        metrics.record(result);
        if (result.status() == DrainResult.Status.DRAINED && result.batches() > 0) {
            log.debug("Drained library queue endpoint={} batches={} items={}",
                    endpoint.name(), result.batches(), result.items());
        }
        return result;
    }
}
