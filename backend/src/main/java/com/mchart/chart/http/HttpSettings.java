package com.mchart.chart.http;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mchart.config.ChartProperties;

/**
 * Connection and retry settings handed to each crawl worker. Plain data so it can cross into a child JVM.
 */
public record HttpSettings(
    @JsonProperty("user_agent") String userAgent,
    @JsonProperty("request_timeout_seconds") int requestTimeoutSeconds,
    @JsonProperty("proxy") String proxy,
    @JsonProperty("max_retries") int maxRetries,
    @JsonProperty("retry_base_delay_ms") int retryBaseDelayMs,
    @JsonProperty("retry_max_delay_ms") int retryMaxDelayMs
) {
    public HttpSettings {
        userAgent = ChartProperties.normalizeUserAgent(userAgent);
        requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        maxRetries = Math.max(0, maxRetries);
        retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public static HttpSettings from(ChartProperties properties) {
        return new HttpSettings(
            properties.getUserAgent(),
            properties.getRequestTimeoutSeconds(),
            properties.getProxy(),
            properties.getRetry().getMaxRetries(),
            properties.getRetry().getBaseDelayMs(),
            properties.getRetry().getMaxDelayMs()
        );
    }
}
