package com.mediasync.mediaserver;

import com.mediasync.mediaserver.config.MediaServerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MediaServerProperties.class)
public class MediaServerServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(MediaServerServiceApplication.class, args);
    }
}
