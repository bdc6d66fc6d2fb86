package com.mediasync.mediaserver.application;

import com.mediasync.mediaserver.client.IdentityClient;
import com.mediasync.mediaserver.client.MediaServerException;
import com.mediasync.mediaserver.config.MediaServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatches UI actions for the identity-service sign-in flow. Problems are reported through
 * {@link ActionResult} rather than thrown.
 */
@Service
public class NotifierActionService {

    private static final Logger log = LoggerFactory.getLogger(NotifierActionService.class);

    public static final String START_OAUTH = "startOAuth";
    public static final String CONTINUE_OAUTH = "continueOAuth";
    public static final String GET_OAUTH_TOKEN = "getOAuthToken";

    private final IdentityClient identityClient;
    private final MediaServerProperties.Identity identity;

    public NotifierActionService(IdentityClient identityClient, MediaServerProperties props) {
        this.identityClient = identityClient;
        this.identity = props.getIdentity();
    }

    public ActionResult requestAction(String action, Map<String, String> query) {
        return switch (action) {
            case START_OAUTH -> startOAuth();
            case CONTINUE_OAUTH -> continueOAuth(query);
            case GET_OAUTH_TOKEN -> getOAuthToken(query);
            default -> ActionResult.empty();
        };
    }

    private ActionResult startOAuth() {
        if (!identity.isConfigured()) {
            return missingIdentitySettings();
        }
        return ActionResult.ok(identityClient.pinRequest());
    }

    private ActionResult continueOAuth(Map<String, String> query) {
        if (!identity.isConfigured()) {
            return missingIdentitySettings();
        }
        Optional<String> callbackUrl = param(query, "callbackUrl");
        if (callbackUrl.isEmpty()) {
            return ActionResult.invalid("QueryParam callbackUrl invalid.");
        }
        Optional<Integer> id = param(query, "id").flatMap(NotifierActionService::parseInt);
        if (id.isEmpty()) {
            return ActionResult.invalid("QueryParam id invalid.");
        }
        Optional<String> code = param(query, "code");
        if (code.isEmpty()) {
            return ActionResult.invalid("QueryParam code invalid.");
        }
        return ActionResult.ok(Map.of("oauthUrl", identityClient.signInUrl(callbackUrl.get(), id.get(), code.get())));
    }

    private ActionResult getOAuthToken(Map<String, String> query) {
        if (!identity.isConfigured()) {
            return missingIdentitySettings();
        }
        Optional<Integer> pinId = param(query, "pinId").flatMap(NotifierActionService::parseInt);
        if (pinId.isEmpty()) {
            return ActionResult.invalid("QueryParam pinId invalid.");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("authToken", identityClient.authToken(pinId.get()).orElse(null));
            return ActionResult.ok(body);
        } catch (MediaServerException e) {
            log.warn("Fetching auth token failed pinId={}", pinId.get(), e);
            return ActionResult.upstreamError(e.getMessage());
        }
    }

    private ActionResult missingIdentitySettings() {
        return ActionResult.configurationError("media-server.identity.client-identifier and product must be configured");
    }

    private static Optional<String> param(Map<String, String> query, String name) {
        String value = query.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
