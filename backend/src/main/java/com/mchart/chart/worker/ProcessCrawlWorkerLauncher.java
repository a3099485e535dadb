package com.mchart.chart.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchart.chart.error.ChartFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Runs every crawl in a freshly started JVM. The request goes in through a file, the result comes back
 * through a second file written once by the child. An absent or empty result file means "no data" when the
 * child exits cleanly and a worker failure otherwise.
 * The child is always joined, or force-terminated and then joined, before this method returns.
 */
public class ProcessCrawlWorkerLauncher implements CrawlWorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessCrawlWorkerLauncher.class);

    private final WorkerCommandFactory commandFactory;
    private final ObjectMapper objectMapper;
    private final int workerTimeoutSeconds;

    public ProcessCrawlWorkerLauncher(WorkerCommandFactory commandFactory, ObjectMapper objectMapper, int workerTimeoutSeconds) {
        this.commandFactory = commandFactory;
        this.objectMapper = objectMapper;
        this.workerTimeoutSeconds = Math.max(1, workerTimeoutSeconds);
    }

    @Override
    public Optional<CrawlWorkerResult> launch(CrawlWorkerRequest request) {
        Path workDir = null;
        Process process = null;
        try {
            workDir = Files.createTempDirectory("mchart-crawl-");
            Path requestFile = workDir.resolve("request.json");
            Path resultFile = workDir.resolve("result.json");
            objectMapper.writeValue(requestFile.toFile(), request);

            List<String> command = commandFactory.command(requestFile, resultFile);
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .start();
            log.debug("crawl worker started chart={} pid={}", request.chartId(), process.pid());

            if (!process.waitFor(workerTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("crawl worker timed out chart={} pid={} timeoutSeconds={}", request.chartId(), process.pid(), workerTimeoutSeconds);
                throw new ChartFetchException(
                    request.chartId(),
                    request.url(),
                    0,
                    "worker_timeout",
                    "worker did not finish within " + workerTimeoutSeconds + "s"
                );
            }
            int exitCode = process.exitValue();
            if (!Files.isRegularFile(resultFile) || Files.size(resultFile) == 0) {
                if (exitCode != 0) {
                    log.warn("crawl worker failed chart={} exitCode={}", request.chartId(), exitCode);
                    throw new ChartFetchException(
                        request.chartId(),
                        request.url(),
                        0,
                        "worker_failed",
                        "worker exited with code " + exitCode
                    );
                }
                log.warn("crawl worker returned no data chart={}", request.chartId());
                return Optional.empty();
            }
            log.debug("crawl worker finished chart={} exitCode={}", request.chartId(), exitCode);
            return Optional.of(objectMapper.readValue(resultFile.toFile(), CrawlWorkerResult.class));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChartFetchException(request.chartId(), request.url(), 0, "interrupted", "interrupted while waiting for worker", e);
        } catch (IOException e) {
            throw new ChartFetchException(request.chartId(), request.url(), 0, "worker_io_error", e.getMessage(), e);
        } finally {
            terminate(process);
            deleteQuietly(workDir);
        }
    }

    private void terminate(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.destroyForcibly();
        try {
            process.waitFor(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while reaping crawl worker pid={}", process.pid());
        }
    }

    private void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("could not clean crawl work dir {}: {}", dir, e.getMessage());
        }
    }
}
