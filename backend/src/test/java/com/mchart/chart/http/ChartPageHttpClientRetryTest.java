package com.mchart.chart.http;

import com.mchart.chart.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChartPageHttpClientRetryTest {
    private MockWebServer server;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void retriesTransientStatusesUntilSuccess() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));
        server.start();

        ChartPageHttpClient client = new ChartPageHttpClient(settings(3));
        HttpFetchResult result = client.get(server.url("/charts/hot-100").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.body()).isEqualTo("<html>ok</html>");
        assertThat(server.getRequestCount()).isEqualTo(3);

        RecordedRequest first = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(first).isNotNull();
        assertThat(first.getHeader("User-Agent")).isEqualTo("mchart-test/1.0");
        assertThat(first.getPath()).isEqualTo("/charts/hot-100");
    }

    @Test
    void doesNotRetryNonTransientStatus() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
        server.start();

        HttpFetchResult result = new ChartPageHttpClient(settings(3)).get(server.url("/charts/gone").toString());

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void stopsAfterRetryCeiling() throws Exception {
        server = new MockWebServer();
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(502));
        }
        server.start();

        HttpFetchResult result = new ChartPageHttpClient(settings(2)).get(server.url("/charts/hot-100").toString());

        assertThat(result.statusCode()).isEqualTo(502);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void transportErrorsAreReportedWithoutRetry() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/charts/hot-100").toString();
        server.shutdown();
        server = null;

        HttpFetchResult result = new ChartPageHttpClient(settings(3)).get(url);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isNotNull();
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void invalidUrlIsReportedAsErrorCode() {
        HttpFetchResult result = new ChartPageHttpClient(settings(3)).get("   ");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.statusCode()).isZero();
    }

    @Test
    void backoffDoublesAndIsCapped() {
        ChartPageHttpClient client = new ChartPageHttpClient(
            new HttpSettings("mchart-test/1.0", 5, null, 6, 1000, 16000)
        );

        assertThat(client.backoffDelayMs(1)).isEqualTo(1000);
        assertThat(client.backoffDelayMs(2)).isEqualTo(2000);
        assertThat(client.backoffDelayMs(4)).isEqualTo(8000);
        assertThat(client.backoffDelayMs(5)).isEqualTo(16000);
        assertThat(client.backoffDelayMs(9)).isEqualTo(16000);
    }

    @Test
    void retryableStatusesAreTheTransientOnes() {
        assertThat(ChartPageHttpClient.RETRYABLE_STATUSES).containsExactlyInAnyOrder(429, 500, 502, 503, 504);
    }

    private static HttpSettings settings(int maxRetries) {
        return new HttpSettings("mchart-test/1.0", 5, null, maxRetries, 1, 2);
    }
}
