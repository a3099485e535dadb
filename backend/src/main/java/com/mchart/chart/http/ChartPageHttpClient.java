package com.mchart.chart.http;

import com.mchart.chart.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * Fetches chart pages, retrying rate-limit and server-error responses with capped exponential backoff.
 * One instance belongs to one crawl; nothing is shared between crawls.
 */
public class ChartPageHttpClient {
    private static final Logger log = LoggerFactory.getLogger(ChartPageHttpClient.class);
    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final HttpSettings settings;
    private final HttpClient client;

    public ChartPageHttpClient(HttpSettings settings) {
        this.settings = settings;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(settings.requestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);
        ProxySelector proxySelector = proxySelector(settings.proxy());
        if (proxySelector != null) {
            builder.proxy(proxySelector);
        }
        this.client = builder.build();
    }

    public HttpFetchResult get(String url) {
        int maxAttempts = 1 + settings.maxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, attempt);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying {} (status {}) attempt={}/{}", url, lastResult.statusCode(), attempt + 1, maxAttempts);
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    long backoffDelayMs(int attempt) {
        int baseDelayMs = settings.retryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(30, Math.max(0, attempt - 1)));
        int maxDelayMs = settings.retryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    private HttpFetchResult executeOnce(String url, int attempt) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, attempt, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(settings.requestTimeoutSeconds()))
            .header("User-Agent", settings.userAgent())
            .header("Accept", ACCEPT_HTML)
            .header("Accept-Language", "en-US,en;q=0.9")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                attempt,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, attempt, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, attempt, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, attempt, startedAt, "interrupted", e.getMessage());
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null || result.errorCode() != null) {
            return false;
        }
        return RETRYABLE_STATUSES.contains(result.statusCode());
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffDelayMs(attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, int attempt, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            attempt,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private static ProxySelector proxySelector(String proxy) {
        if (proxy == null || proxy.isBlank()) {
            return null;
        }
        URI uri = normalizeUri(proxy);
        if (uri == null || uri.getHost() == null) {
            log.warn("Ignoring malformed proxy setting {}", proxy);
            return null;
        }
        int port = uri.getPort() > 0 ? uri.getPort() : 8080;
        return ProxySelector.of(new InetSocketAddress(uri.getHost(), port));
    }

    private static URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
