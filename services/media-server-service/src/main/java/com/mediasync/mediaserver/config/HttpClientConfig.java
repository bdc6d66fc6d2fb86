package com.mediasync.mediaserver.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate mediaServerRestTemplate(RestTemplateBuilder builder, MediaServerProperties props) {
        return builder
                .setConnectTimeout(props.getHttp().getConnectTimeout())
                .setReadTimeout(props.getHttp().getReadTimeout())
                .build();
    }
}
