package com.mediasync.mediaserver.metrics;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.DrainResult;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class RefreshMetrics {

    private final Counter enqueued;
    private final Counter batches;
    private final Counter items;
    private final Counter discarded;
    private final Counter failures;
    private final Counter busy;

    public RefreshMetrics(MeterRegistry registry,
                          CoalescingRefreshQueue<MediaServerEndpoint, Series> queue,
                          EndpointRegistry endpoints) {
        this.enqueued = Counter.builder("mediaserver.refresh.enqueued").register(registry);
        this.batches = Counter.builder("mediaserver.refresh.batches").register(registry);
        this.items = Counter.builder("mediaserver.refresh.items").register(registry);
        this.discarded = Counter.builder("mediaserver.refresh.discarded").register(registry);
        this.failures = Counter.builder("mediaserver.refresh.failures").register(registry);
        this.busy = Counter.builder("mediaserver.refresh.busy").register(registry);

        // endpoints sharing a key report the same queue once
        Gauge.builder("mediaserver.refresh.pending", () -> endpoints.all().stream()
                        .collect(Collectors.toMap(MediaServerEndpoint::key, queue::pendingCount, (a, b) -> a))
                        .values().stream().mapToInt(Integer::intValue).sum())
                .register(registry);
    }

    public void incEnqueued() { enqueued.increment(); }
    public void incFailure() { failures.increment(); }

    public void record(DrainResult result) {
        switch (result.status()) {
            case BUSY -> busy.increment();
            case DRAINED -> {
                batches.increment(result.batches());
                items.increment(result.items());
                discarded.increment(result.discarded());
            }
            case NO_QUEUE -> {
                // nothing queued yet for this endpoint
            }
        }
    }
}
