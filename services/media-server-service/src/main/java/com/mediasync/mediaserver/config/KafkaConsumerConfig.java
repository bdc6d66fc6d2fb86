package com.mediasync.mediaserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediasync.contracts.events.SeriesChangedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.Map;

@Configuration
@ConditionalOnProperty(prefix = "media-server.kafka", name = "enabled", havingValue = "true")
public class KafkaConsumerConfig {

    @Bean
    public ConsumerFactory<String, SeriesChangedEvent> seriesChangedConsumerFactory(KafkaProperties kafkaProperties,
                                                                                   MediaServerProperties props,
                                                                                   ObjectMapper objectMapper) {
        Map<String, Object> config = kafkaProperties.buildConsumerProperties(null);
        config.put(ConsumerConfig.GROUP_ID_CONFIG, props.getKafka().getGroupId());

        JsonDeserializer<SeriesChangedEvent> json = new JsonDeserializer<>(SeriesChangedEvent.class, objectMapper, false);
        return new DefaultKafkaConsumerFactory<>(config,
                new StringDeserializer(),
                new ErrorHandlingDeserializer<>(json));
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, SeriesChangedEvent> seriesChangedListenerContainerFactory(
            ConsumerFactory<String, SeriesChangedEvent> seriesChangedConsumerFactory,
            MediaServerProperties props) {
        ConcurrentKafkaListenerContainerFactory<String, SeriesChangedEvent> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(seriesChangedConsumerFactory);
        factory.setConcurrency(props.getKafka().getConcurrency());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.getContainerProperties().setMissingTopicsFatal(false);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(new FixedBackOff(1000L, 3L));
        errorHandler.addNotRetryableExceptions(IllegalArgumentException.class);
        factory.setCommonErrorHandler(errorHandler);
        return factory;
    }
}
