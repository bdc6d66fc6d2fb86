package com.mediasync.common.refresh.autoconfigure;

import com.mediasync.common.refresh.config.RefreshQueueProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@AutoConfiguration
@EnableConfigurationProperties(RefreshQueueProperties.class)
public class RefreshQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RefreshQueueFactory refreshQueueFactory(RefreshQueueProperties props,
                                                   ObjectProvider<RefreshStoreObserver> observers) {
        return new RefreshQueueFactory(props, observers.orderedStream().toList());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class StoreMetricsConfiguration {

        @Bean
        public RefreshStoreObserver caffeineStoreMetrics(ObjectProvider<MeterRegistry> registry,
                                                         RefreshQueueProperties props) {
            return (queueName, store) -> {
                if (!props.isRecordStats()) {
                    return;
                }
                registry.ifAvailable(r -> CaffeineCacheMetrics.monitor(r, store.nativeCache(), "refresh_" + queueName));
            };
        }
    }
}
