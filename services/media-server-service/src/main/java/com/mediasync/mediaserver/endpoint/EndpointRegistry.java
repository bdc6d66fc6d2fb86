package com.mediasync.mediaserver.endpoint;

import com.mediasync.mediaserver.config.MediaServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class EndpointRegistry {

    private static final Logger log = LoggerFactory.getLogger(EndpointRegistry.class);

    private final Map<String, MediaServerEndpoint> byName = new LinkedHashMap<>();

    public EndpointRegistry(MediaServerProperties props) {
        for (MediaServerProperties.Endpoint e : props.getEndpoints()) {
            MediaServerEndpoint endpoint = MediaServerEndpoint.from(e);
            if (byName.putIfAbsent(endpoint.name(), endpoint) != null) {
                throw new IllegalStateException("duplicate media server endpoint name=" + endpoint.name());
            }
            log.info("Registered media server endpoint name={} key={} updateLibrary={}",
                    endpoint.name(), endpoint.key(), endpoint.updateLibrary());
        }
    }

    public List<MediaServerEndpoint> all() {
        return List.copyOf(byName.values());
    }

    public Optional<MediaServerEndpoint> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }
}
