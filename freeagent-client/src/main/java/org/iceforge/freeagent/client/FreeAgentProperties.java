package org.iceforge.freeagent.client;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection and cache settings for the FreeAgent client.
 * <p>
 * Defaults target the production API with a five minute cache.
 */
@ConfigurationProperties(prefix = "freeagent")
public class FreeAgentProperties {

    public static final String PRODUCTION_API_BASE_URL = "https://api.freeagent.com";
    public static final String SANDBOX_API_BASE_URL = "https://api.sandbox.freeagent.com";

    /** Explicit API root. When unset the production or sandbox root is used depending on {@link #sandbox}. */
    private String apiBaseUrl;

    private boolean sandbox = false;

    /** OAuth bearer token. Obtaining and refreshing it happens outside this client. */
    private String accessToken;

    private String userAgent = "iceforge-freeagent-client/1.0";

    private Duration requestTimeout = Duration.ofSeconds(30);

    private Cache cache = new Cache();

    public String resolvedApiBaseUrl() {
        if (apiBaseUrl != null && !apiBaseUrl.isBlank()) {
            String url = apiBaseUrl.trim();
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
        return sandbox ? SANDBOX_API_BASE_URL : PRODUCTION_API_BASE_URL;
    }

    public void validate() {
        List<String> problems = new ArrayList<>();

        if (accessToken == null || accessToken.isBlank()) {
            problems.add("freeagent.access-token is required");
        }

        String base = resolvedApiBaseUrl();
        try {
            URI uri = URI.create(base);
            if (uri.getScheme() == null || !(uri.getScheme().equals("https") || uri.getScheme().equals("http"))
                    || uri.getHost() == null) {
                problems.add("freeagent.api-base-url must be an absolute http(s) URL: " + base);
            }
        } catch (IllegalArgumentException e) {
            problems.add("freeagent.api-base-url is not a valid URL: " + base);
        }

        if (userAgent == null || userAgent.isBlank()) {
            problems.add("freeagent.user-agent must not be blank");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            problems.add("freeagent.request-timeout must be positive");
        }
        if (cache == null) {
            problems.add("freeagent.cache must not be null");
        } else if (cache.getTtl() == null || cache.getTtl().isNegative()) {
            problems.add("freeagent.cache.ttl must be zero or positive");
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid FreeAgent configuration: " + String.join("; ", problems));
        }
    }

    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

    public boolean isSandbox() { return sandbox; }
    public void setSandbox(boolean sandbox) { this.sandbox = sandbox; }

    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public static class Cache {
        /** When false every read goes to the API. */
        private boolean enabled = true;

        /** Lifetime of a cached entity or list. Zero keeps entries until they are invalidated. */
        private Duration ttl = Duration.ofMinutes(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
    }
}
