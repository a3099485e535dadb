package com.mchart.chart.worker;

import com.mchart.chart.catalog.ChartCatalog;
import com.mchart.chart.catalog.ChartDefinition;
import com.mchart.chart.extract.ChartPageParser;
import com.mchart.chart.http.ChartPageHttpClient;
import com.mchart.chart.model.ChartPageResult;
import com.mchart.chart.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One fetch-and-extract cycle. Builds its own HTTP client and parser on every run, so runs share no state.
 */
public class ChartCrawlWorker {
    private static final Logger log = LoggerFactory.getLogger(ChartCrawlWorker.class);

    private final Clock clock;

    public ChartCrawlWorker(Clock clock) {
        this.clock = clock;
    }

    public CrawlWorkerResult run(CrawlWorkerRequest request) {
        ChartDefinition chart = ChartCatalog.find(request.chartId()).orElse(null);
        if (chart == null) {
            return CrawlWorkerResult.failure(0, "unknown_chart", "Not a canonical chart id: " + request.chartId());
        }

        ChartPageHttpClient httpClient = new ChartPageHttpClient(request.http());
        HttpFetchResult fetch = httpClient.get(request.url());
        if (!fetch.isSuccessful()) {
            String errorCode = fetch.errorCode() != null ? fetch.errorCode() : "http_" + fetch.statusCode();
            String message = fetch.errorMessage() != null ? fetch.errorMessage() : "HTTP status " + fetch.statusCode();
            log.warn(
                "chart fetch failed chart={} url={} status={} errorCode={} attempts={}",
                chart.id(),
                request.url(),
                fetch.statusCode(),
                errorCode,
                fetch.attempts()
            );
            return CrawlWorkerResult.failure(fetch.statusCode(), errorCode, message);
        }

        ChartPageParser parser = new ChartPageParser(clock);
        ChartPageResult page = parser.parse(
            fetch.body(),
            fetch.finalUrlOrRequested(),
            chart,
            request.includeImages(),
            request.maxEntries()
        );
        log.info(
            "chart fetched chart={} url={} rows={} attempts={} durationMs={}",
            chart.id(),
            page.url(),
            page.records().size(),
            fetch.attempts(),
            fetch.duration().toMillis()
        );
        return CrawlWorkerResult.success(page, fetch.statusCode());
    }
}
