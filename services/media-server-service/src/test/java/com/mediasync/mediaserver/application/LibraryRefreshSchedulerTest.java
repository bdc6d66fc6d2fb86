package com.mediasync.mediaserver.application;

import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.DrainResult;
import com.mediasync.mediaserver.client.MediaServerException;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.EndpointRegistry;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import com.mediasync.mediaserver.metrics.RefreshMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LibraryRefreshSchedulerTest {

    @Mock
    private EndpointRegistry endpoints;
    @Mock
    private CoalescingRefreshQueue<MediaServerEndpoint, Series> queue;
    @Mock
    private RefreshMetrics metrics;

    @InjectMocks
    private LibraryRefreshScheduler scheduler;

    private final MediaServerEndpoint den = new MediaServerEndpoint("den", "a", 32400, false, "", null,
            true, null, null);
    private final MediaServerEndpoint attic = new MediaServerEndpoint("attic", "b", 32400, false, "", null,
            true, null, null);

    @Test
    void failingEndpointDoesNotStopOthers() {
        when(endpoints.all()).thenReturn(List.of(den, attic));
        when(queue.drain(den)).thenThrow(new MediaServerException("connection refused"));
        when(queue.drain(attic)).thenReturn(DrainResult.drained(1, 3, 0));

        scheduler.processQueues();

        verify(queue).drain(attic);
        verify(metrics).incFailure();
        verify(metrics).record(DrainResult.drained(1, 3, 0));
    }

    @Test
    void processQueueRethrowsAfterCountingFailure() {
        when(queue.drain(den)).thenThrow(new MediaServerException("connection refused"));

        assertThatThrownBy(() -> scheduler.processQueue(den)).isInstanceOf(MediaServerException.class);
        verify(metrics).incFailure();
        verify(metrics, never()).record(any());
    }

    @Test
    void processQueueReturnsDrainResult() {
        when(queue.drain(den)).thenReturn(DrainResult.busy());

        assertThat(scheduler.processQueue(den)).isEqualTo(DrainResult.busy());
        verify(metrics).record(DrainResult.busy());
    }
}
