package com.mediasync.mediaserver.client;

import com.mediasync.mediaserver.client.dto.SectionsResponse;
import com.mediasync.mediaserver.config.MediaServerProperties;
import com.mediasync.mediaserver.endpoint.MediaServerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * HTTP client for the media server's library API.
 */
@Component
public class MediaServerClient {

    private static final Logger log = LoggerFactory.getLogger(MediaServerClient.class);

    static final String TOKEN_HEADER = "X-Plex-Token";
    static final String CLIENT_ID_HEADER = "X-Plex-Client-Identifier";
    static final String PRODUCT_HEADER = "X-Plex-Product";

    private final RestTemplate restTemplate;
    private final MediaServerProperties.Identity identity;

    public MediaServerClient(RestTemplate restTemplate, MediaServerProperties props) {
        this.restTemplate = restTemplate;
        this.identity = props.getIdentity();
    }

    /**
     * Library sections holding TV shows.
     */
    public List<LibrarySection> getShowSections(MediaServerEndpoint endpoint) {
        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint.baseUrl())
                .path("/library/sections")
                .build()
                .toUri();

        SectionsResponse resp = exchange(endpoint, uri, SectionsResponse.class).getBody();
        if (resp == null || resp.container() == null || resp.container().directories() == null) {
            return List.of();
        }
        return resp.container().directories().stream()
                .filter(d -> "show".equals(d.type()))
                .map(d -> new LibrarySection(
                        d.key(),
                        d.title(),
                        d.locations() == null
                                ? List.of()
                                : d.locations().stream().map(SectionsResponse.Location::path).toList()))
                .toList();
    }

    public void refreshSection(MediaServerEndpoint endpoint, String sectionKey) {
        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint.baseUrl())
                .path("/library/sections/{key}/refresh")
                .encode()
                .buildAndExpand(sectionKey)
                .toUri();
        exchange(endpoint, uri, Void.class);
        log.debug("Requested section refresh endpoint={} section={}", endpoint.name(), sectionKey);
    }

    public void refreshPath(MediaServerEndpoint endpoint, String sectionKey, String path) {
        URI uri = UriComponentsBuilder.fromHttpUrl(endpoint.baseUrl())
                .path("/library/sections/{key}/refresh")
                .queryParam("path", "{path}")
                .encode()
                .buildAndExpand(sectionKey, path)
                .toUri();
        exchange(endpoint, uri, Void.class);
        log.debug("Requested partial refresh endpoint={} section={} path={}", endpoint.name(), sectionKey, path);
    }

    private <R> ResponseEntity<R> exchange(MediaServerEndpoint endpoint, URI uri, Class<R> type) {
        try {
            return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers(endpoint)), type);
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new MediaServerAuthException("media server rejected credentials endpoint=" + endpoint.name(), e);
        } catch (RestClientException e) {
            throw new MediaServerException("media server request failed endpoint=" + endpoint.name()
                    + " uri=" + uri.getPath() + ": " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers(MediaServerEndpoint endpoint) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (endpoint.hasAuthToken()) {
            headers.set(TOKEN_HEADER, endpoint.authToken());
        }
        if (identity.getClientIdentifier() != null) {
            headers.set(CLIENT_ID_HEADER, identity.getClientIdentifier());
        }
        headers.set(PRODUCT_HEADER, identity.getProduct());
        return headers;
    }
}
