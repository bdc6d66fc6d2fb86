package com.mediasync.common.refresh.autoconfigure;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.mediasync.common.refresh.config.RefreshQueueProperties;
import com.mediasync.common.refresh.queue.CoalescingRefreshQueue;
import com.mediasync.common.refresh.queue.PendingQueue;
import com.mediasync.common.refresh.queue.RefreshSink;
import com.mediasync.common.refresh.queue.RefreshTarget;
import com.mediasync.common.refresh.store.CaffeineExpiringKeyedStore;

import java.util.List;
import java.util.function.Function;

public class RefreshQueueFactory {

    private final RefreshQueueProperties props;
    private final List<RefreshStoreObserver> observers;

    public RefreshQueueFactory(RefreshQueueProperties props, List<RefreshStoreObserver> observers) {
        this.props = props;
        this.observers = observers;
    }

    public <E extends RefreshTarget, T> CoalescingRefreshQueue<E, T> create(String name,
                                                                           Function<? super T, ?> identity,
                                                                           RefreshSink<E, T> sink) {
        CaffeineExpiringKeyedStore<String, PendingQueue<T>> store = new CaffeineExpiringKeyedStore<>(builder());
        for (RefreshStoreObserver observer : observers) {
            observer.storeCreated(name, store);
        }
        return new CoalescingRefreshQueue<>(name, store, identity, sink, props.getIdleTtl());
    }

    private Caffeine<Object, Object> builder() {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(props.getMaximumSize());
        if (props.isRecordStats()) {
            builder.recordStats();
        }
        if (props.isBackgroundSweep()) {
            builder.scheduler(Scheduler.systemScheduler());
        }
        return builder;
    }
}
