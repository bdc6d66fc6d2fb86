package com.mediasync.mediaserver.endpoint;

import com.mediasync.common.refresh.queue.RefreshTarget;
import com.mediasync.mediaserver.config.MediaServerProperties;

import java.util.Optional;

/**
 * One configured media server. Endpoints pointing at the same host and port share a refresh queue.
 */
public record MediaServerEndpoint(
        String name,
        String host,
        int port,
        boolean useSsl,
        String urlBase,
        String authToken,
        boolean updateLibrary,
        String pathMapFrom,
        String pathMapTo
) implements RefreshTarget {

    public static MediaServerEndpoint from(MediaServerProperties.Endpoint e) {
        return new MediaServerEndpoint(
                e.getName(),
                e.getHost().trim(),
                e.getPort(),
                e.isUseSsl(),
                e.getUrlBase(),
                e.getAuthToken(),
                e.isUpdateLibrary(),
                e.getPathMapFrom(),
                e.getPathMapTo()
        );
    }

    @Override
    public String key() {
        return host + ":" + port;
    }

    @Override
    public boolean refreshEnabled() {
        return updateLibrary;
    }

    public String baseUrl() {
        String scheme = useSsl ? "https" : "http";
        return scheme + "://" + host + ":" + port + normalizedUrlBase();
    }

    public boolean hasAuthToken() {
        return authToken != null && !authToken.isBlank();
    }

    /**
     * Translates a local series path into the path the media server sees.
     */
    public Optional<String> mapPath(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (pathMapFrom == null || pathMapFrom.isBlank() || pathMapTo == null) {
            return Optional.of(path);
        }
        if (!path.startsWith(pathMapFrom)) {
            return Optional.of(path);
        }
        return Optional.of(pathMapTo + path.substring(pathMapFrom.length()));
    }

    private String normalizedUrlBase() {
        if (urlBase == null || urlBase.isBlank()) {
            return "";
        }
        String base = urlBase.trim();
        if (!base.startsWith("/")) {
            base = "/" + base;
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
