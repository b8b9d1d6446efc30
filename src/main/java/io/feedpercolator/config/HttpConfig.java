package io.feedpercolator.config;

import java.time.Duration;

public record HttpConfig(
        Duration connectTimeout,
        String userAgent
) {
    public static final String DEFAULT_USER_AGENT = "FeedPercolator/1.0";

    public HttpConfig {
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static HttpConfig defaults() {
        return new HttpConfig(null, null);
    }
}
