package com.mchart.chart.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchart.chart.error.ChartFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each crawl on its own single-use thread with a freshly built worker. The result is serialized
 * and read back so only plain data leaves the worker, as with the process launcher.
 */
public class InProcessCrawlWorkerLauncher implements CrawlWorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(InProcessCrawlWorkerLauncher.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int workerTimeoutSeconds;

    public InProcessCrawlWorkerLauncher(ObjectMapper objectMapper, Clock clock, int workerTimeoutSeconds) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.workerTimeoutSeconds = Math.max(1, workerTimeoutSeconds);
    }

    @Override
    public Optional<CrawlWorkerResult> launch(CrawlWorkerRequest request) {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "crawl-worker-" + request.chartId());
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<byte[]> future = executor.submit(() -> runIsolated(request));
            byte[] payload = future.get(workerTimeoutSeconds, TimeUnit.SECONDS);
            if (payload == null || payload.length == 0) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(payload, CrawlWorkerResult.class));
        } catch (TimeoutException e) {
            log.warn("crawl worker timed out chart={} timeoutSeconds={}", request.chartId(), workerTimeoutSeconds);
            throw new ChartFetchException(
                request.chartId(),
                request.url(),
                0,
                "worker_timeout",
                "worker did not finish within " + workerTimeoutSeconds + "s",
                e
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("crawl worker failed chart={}: {}", request.chartId(), cause.toString());
            throw new ChartFetchException(
                request.chartId(),
                request.url(),
                0,
                "worker_failed",
                String.valueOf(cause.getMessage()),
                cause
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChartFetchException(request.chartId(), request.url(), 0, "interrupted", "interrupted while waiting for worker", e);
        } catch (IOException e) {
            throw new ChartFetchException(request.chartId(), request.url(), 0, "worker_io_error", e.getMessage(), e);
        } finally {
            executor.shutdownNow();
        }
    }

    private byte[] runIsolated(CrawlWorkerRequest request) throws IOException {
        CrawlWorkerRequest copy = objectMapper.readValue(objectMapper.writeValueAsBytes(request), CrawlWorkerRequest.class);
        CrawlWorkerResult result = new ChartCrawlWorker(clock).run(copy);
        return objectMapper.writeValueAsBytes(result);
    }
}
