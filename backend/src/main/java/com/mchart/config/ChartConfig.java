package com.mchart.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mchart.chart.worker.CrawlWorkerLauncher;
import com.mchart.chart.worker.InProcessCrawlWorkerLauncher;
import com.mchart.chart.worker.ProcessCrawlWorkerLauncher;
import com.mchart.chart.worker.WorkerCommandFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ChartConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CrawlWorkerLauncher crawlWorkerLauncher(ChartProperties properties, ObjectMapper objectMapper, Clock clock) {
        ChartProperties.Isolation isolation = properties.getIsolation();
        if (isolation.getMode() == ChartProperties.IsolationMode.IN_PROCESS) {
            return new InProcessCrawlWorkerLauncher(objectMapper, clock, isolation.getWorkerTimeoutSeconds());
        }
        return new ProcessCrawlWorkerLauncher(
            WorkerCommandFactory.fromProperties(isolation),
            objectMapper,
            isolation.getWorkerTimeoutSeconds()
        );
    }

    /**
     * Mapper shared by the application context and the worker JVM, which has no Spring context.
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
