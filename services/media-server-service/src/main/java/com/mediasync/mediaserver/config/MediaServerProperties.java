package com.mediasync.mediaserver.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "media-server")
public class MediaServerProperties {

    @Valid
    private List<Endpoint> endpoints = new ArrayList<>();

    private final Refresh refresh = new Refresh();
    private final Identity identity = new Identity();
    private final Http http = new Http();
    private final Kafka kafka = new Kafka();

    public List<Endpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(List<Endpoint> endpoints) {
        this.endpoints = endpoints;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public Identity getIdentity() {
        return identity;
    }

    public Http getHttp() {
        return http;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public static class Endpoint {
        @NotBlank
        private String name;
        @NotBlank
        private String host;
        @Min(1)
        @Max(65535)
        private int port = 32400;
        private boolean useSsl = false;
        private String urlBase = "";
        private String authToken;
        // toggles both queueing and the refresh call
        private boolean updateLibrary = true;
        private String pathMapFrom;
        private String pathMapTo;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public boolean isUseSsl() {
            return useSsl;
        }

        public void setUseSsl(boolean useSsl) {
            this.useSsl = useSsl;
        }

        public String getUrlBase() {
            return urlBase;
        }

        public void setUrlBase(String urlBase) {
            this.urlBase = urlBase;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }

        public boolean isUpdateLibrary() {
            return updateLibrary;
        }

        public void setUpdateLibrary(boolean updateLibrary) {
            this.updateLibrary = updateLibrary;
        }

        public String getPathMapFrom() {
            return pathMapFrom;
        }

        public void setPathMapFrom(String pathMapFrom) {
            this.pathMapFrom = pathMapFrom;
        }

        public String getPathMapTo() {
            return pathMapTo;
        }

        public void setPathMapTo(String pathMapTo) {
            this.pathMapTo = pathMapTo;
        }
    }

    public static class Refresh {
        private long intervalMs = 5000L;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Identity {
        private String baseUrl = "https://plex.tv/api/v2";
        private String signInUrl = "https://app.plex.tv/auth/";
        private String clientIdentifier;
        private String product = "MediaSync";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSignInUrl() {
            return signInUrl;
        }

        public void setSignInUrl(String signInUrl) {
            this.signInUrl = signInUrl;
        }

        public String getClientIdentifier() {
            return clientIdentifier;
        }

        public void setClientIdentifier(String clientIdentifier) {
            this.clientIdentifier = clientIdentifier;
        }

        public String getProduct() {
            return product;
        }

        public void setProduct(String product) {
            this.product = product;
        }

        public boolean isConfigured() {
            return clientIdentifier != null && !clientIdentifier.isBlank()
                    && product != null && !product.isBlank();
        }
    }

    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Kafka {
        private boolean enabled = false;
        private String groupId = "media-server-notifier-v1";
        private int concurrency = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }
}
