package com.mediasync.mediaserver.application;

import com.mediasync.common.refresh.queue.RefreshSink;
import com.mediasync.mediaserver.client.LibrarySection;
import com.mediasync.mediaserver.client.MediaServerAuthException;
import com.mediasync.mediaserver.client.MediaServerClient;
import com.mediasync.mediaserver.client.MediaServerException;
import com.mediasync.mediaserver.domain.Series;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pushes a batch of changed series to one media server: a partial scan per series folder where the
 * owning library section is known, one full scan of every TV section otherwise.
 */
@Service
public class LibraryUpdateService implements RefreshSink<MediaServerEndpoint, Series> {

    private static final Logger log = LoggerFactory.getLogger(LibraryUpdateService.class);

    private final MediaServerClient client;

    public LibraryUpdateService(MediaServerClient client) {
        this.client = client;
    }

    @Override
    public void refresh(List<Series> batch, MediaServerEndpoint endpoint) {
        if (batch.isEmpty()) {
            return;
        }
        List<LibrarySection> sections = client.getShowSections(endpoint);
        if (sections.isEmpty()) {
            log.warn("No TV library sections on media server endpoint={}, skipping {} series",
                    endpoint.name(), batch.size());
            return;
        }

        Set<String> scanned = new LinkedHashSet<>();
        List<Series> unmatched = new ArrayList<>();
        for (Series series : batch) {
            Optional<String> path = endpoint.mapPath(series.path());
            Optional<LibrarySection> section = path.flatMap(p -> findSection(sections, p));
            if (section.isEmpty()) {
                unmatched.add(series);
                continue;
            }
            if (scanned.add(section.get().key() + "|" + path.get())) {
                client.refreshPath(endpoint, section.get().key(), path.get());
            }
        }

        if (!unmatched.isEmpty()) {
            log.debug("No section matched {} series, refreshing all TV sections endpoint={} seriesIds={}",
                    unmatched.size(), endpoint.name(), unmatched.stream().map(Series::id).toList());
            for (LibrarySection section : sections) {
                client.refreshSection(endpoint, section.key());
            }
        }
        log.info("Library update sent endpoint={} series={} partialScans={} fullRefresh={}",
                endpoint.name(), batch.size(), scanned.size(), !unmatched.isEmpty());
    }

    /**
     * Checks that the endpoint answers with valid credentials and has at least one TV library.
     */
    public List<ValidationFailure> test(MediaServerEndpoint endpoint) {
        try {
            List<LibrarySection> sections = client.getShowSections(endpoint);
            if (sections.isEmpty()) {
                return List.of(new ValidationFailure("host", "At least one TV library is required"));
            }
            return List.of();
        } catch (MediaServerAuthException e) {
            log.warn("Media server test unauthorized endpoint={}", endpoint.name());
            return List.of(new ValidationFailure("authToken", "Authentication failed, check the auth token"));
        } catch (MediaServerException e) {
            log.warn("Media server test failed endpoint={}", endpoint.name(), e);
            return List.of(new ValidationFailure("host", "Unable to connect to media server: " + e.getMessage()));
        }
    }

    private Optional<LibrarySection> findSection(List<LibrarySection> sections, String path) {
        return sections.stream().filter(s -> s.contains(path)).findFirst();
    }
}
