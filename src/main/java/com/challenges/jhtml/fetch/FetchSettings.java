package com.challenges.jhtml.fetch;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for {@link HtmlFetcher}.
 */
public record FetchSettings(Duration connectTimeout, Duration readTimeout, Duration callTimeout, String userAgent) {

    public static final String DEFAULT_USER_AGENT = "jhtml/1.0";

    public FetchSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
        Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = DEFAULT_USER_AGENT;
        }
    }

    public static FetchSettings defaults() {
        return new FetchSettings(Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(60), DEFAULT_USER_AGENT);
    }

    public FetchSettings withConnectTimeout(Duration timeout) {
        return new FetchSettings(timeout, readTimeout, callTimeout, userAgent);
    }

    public FetchSettings withReadTimeout(Duration timeout) {
        return new FetchSettings(connectTimeout, timeout, callTimeout, userAgent);
    }

    public FetchSettings withUserAgent(String agent) {
        return new FetchSettings(connectTimeout, readTimeout, callTimeout, agent);
    }
}
