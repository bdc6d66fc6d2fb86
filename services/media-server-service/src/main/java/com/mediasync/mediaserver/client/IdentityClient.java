package com.mediasync.mediaserver.client;

import com.mediasync.mediaserver.client.dto.PinRequest;
import com.mediasync.mediaserver.client.dto.PinResponse;
import com.mediasync.mediaserver.config.MediaServerProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the identity service's PIN based sign-in.
 */
@Component
public class IdentityClient {

    private final RestTemplate restTemplate;
    private final MediaServerProperties.Identity identity;

    public IdentityClient(RestTemplate restTemplate, MediaServerProperties props) {
        this.restTemplate = restTemplate;
        this.identity = props.getIdentity();
    }

    public PinRequest pinRequest() {
        String url = UriComponentsBuilder.fromHttpUrl(identity.getBaseUrl())
                .path("/pins")
                .queryParam("strong", true)
                .toUriString();
        return new PinRequest(url, "POST", clientHeaders());
    }

    public String signInUrl(String callbackUrl, int pinId, String code) {
        String query = UriComponentsBuilder.newInstance()
                .queryParam("clientID", identity.getClientIdentifier())
                .queryParam("forwardUrl", callbackUrl)
                .queryParam("pinID", pinId)
                .queryParam("code", code)
                .queryParam("context[device][product]", identity.getProduct())
                .build()
                .encode()
                .getQuery();
        return identity.getSignInUrl() + "#?" + query;
    }

    public Optional<String> authToken(int pinId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(identity.getBaseUrl())
                .path("/pins/{id}")
                .buildAndExpand(pinId)
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        clientHeaders().forEach(headers::set);

        PinResponse pin;
        try {
            pin = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), PinResponse.class).getBody();
        } catch (RestClientException e) {
            throw new MediaServerException("identity service request failed pinId=" + pinId + ": " + e.getMessage(), e);
        }
        if (pin == null || pin.authToken() == null || pin.authToken().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(pin.authToken());
    }

    private Map<String, String> clientHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", MediaType.APPLICATION_JSON_VALUE);
        headers.put(MediaServerClient.PRODUCT_HEADER, identity.getProduct());
        headers.put(MediaServerClient.CLIENT_ID_HEADER, identity.getClientIdentifier());
        return headers;
    }
}
