package com.mediasync.common.refresh.autoconfigure;

import com.mediasync.common.refresh.store.CaffeineExpiringKeyedStore;

/**
 * Callback for every store created by {@link RefreshQueueFactory}, e.g. to bind metrics.
 */
@FunctionalInterface
public interface RefreshStoreObserver {
    void storeCreated(String queueName, CaffeineExpiringKeyedStore<String, ?> store);
}
