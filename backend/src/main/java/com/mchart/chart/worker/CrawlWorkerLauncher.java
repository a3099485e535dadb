package com.mchart.chart.worker;

import java.util.Optional;

/**
 * Runs one crawl in an isolated execution context and hands back only plain data.
 */
public interface CrawlWorkerLauncher {

    /**
     * Blocks until the worker has finished and been cleaned up.
     *
     * @return the worker's result, or empty when the worker finished cleanly without producing anything
     * @throws com.mchart.chart.error.ChartFetchException when the worker crashes or outlives its timeout
     */
    Optional<CrawlWorkerResult> launch(CrawlWorkerRequest request);
}
