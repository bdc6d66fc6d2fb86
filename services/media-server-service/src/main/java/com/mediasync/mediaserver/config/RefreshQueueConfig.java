package com.mediasync.mediaserver.config;

import com.mediasync.common.refresh.autoconfigure.RefreshQueueFactory;
import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.mediaserver.application.LibraryUpdateService;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RefreshQueueConfig {

    @Bean
    public CoalescingRefreshQueue<MediaServerEndpoint, Series> libraryRefreshQueue(RefreshQueueFactory factory,
                                                                                 LibraryUpdateService libraryUpdateService) {
        // one pending entry per series, latest notification wins
        return factory.create("library", Series::id, libraryUpdateService);
    }
}
