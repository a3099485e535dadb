package com.mchart.chart.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mchart.config.ChartConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Entry point of the crawl worker JVM: {@code <request.json> <result.json>}.
 * Writes the result file once, atomically, and exits. No Spring context is started here.
 */
public final class ChartCrawlWorkerMain {
    private static final Logger log = LoggerFactory.getLogger(ChartCrawlWorkerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    private ChartCrawlWorkerMain() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length != 2) {
            log.error("usage: ChartCrawlWorkerMain <request-file> <result-file>");
            return EXIT_USAGE;
        }
        Path requestFile = Path.of(args[0]);
        Path resultFile = Path.of(args[1]);
        ObjectMapper objectMapper = ChartConfig.newObjectMapper();
        try {
            CrawlWorkerRequest request = objectMapper.readValue(requestFile.toFile(), CrawlWorkerRequest.class);
            CrawlWorkerResult result = new ChartCrawlWorker(Clock.systemDefaultZone()).run(request);
            Path partial = resultFile.resolveSibling(resultFile.getFileName() + ".partial");
            objectMapper.writeValue(partial.toFile(), result);
            Files.move(partial, resultFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return EXIT_OK;
        } catch (Exception e) {
            log.error("crawl worker failed request={}", requestFile, e);
            return EXIT_FAILED;
        }
    }
}
