package com.mchart.chart.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchart.chart.ChartPageFixtures;
import com.mchart.config.ChartConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class ChartCrawlWorkerMainTest {
    private final ObjectMapper objectMapper = ChartConfig.newObjectMapper();
    private MockWebServer server;

    @TempDir
    Path scratch;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
    }

    @Test
    void writesResultFileOnceAndLeavesNoPartialFile() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody(ChartPageFixtures.HOT_100_PAGE));
        server.start();
        Path requestFile = scratch.resolve("request.json");
        Path resultFile = scratch.resolve("result.json");
        objectMapper.writeValue(
            requestFile.toFile(),
            ChartCrawlWorkerTest.request("hot-100", server.url("/charts/hot-100").toString(), 0)
        );

        int exit = ChartCrawlWorkerMain.run(new String[] {requestFile.toString(), resultFile.toString()});

        assertEquals(ChartCrawlWorkerMain.EXIT_OK, exit);
        CrawlWorkerResult result = objectMapper.readValue(resultFile.toFile(), CrawlWorkerResult.class);
        assertThat(result.page().records()).hasSize(2);
        assertFalse(Files.exists(scratch.resolve("result.json.partial")));
    }

    @Test
    void wrongArgumentCountIsAUsageError() {
        assertEquals(ChartCrawlWorkerMain.EXIT_USAGE, ChartCrawlWorkerMain.run(new String[] {"only-one"}));
    }

    @Test
    void unreadableRequestFailsWithoutWritingResult() {
        Path resultFile = scratch.resolve("result.json");

        int exit = ChartCrawlWorkerMain.run(new String[] {scratch.resolve("missing.json").toString(), resultFile.toString()});

        assertEquals(ChartCrawlWorkerMain.EXIT_FAILED, exit);
        assertFalse(Files.exists(resultFile));
    }
}
