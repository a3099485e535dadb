package com.mchart.chart.worker;

import com.mchart.chart.catalog.ResolvedChart;
import com.mchart.chart.error.ChartFetchException;
import com.mchart.chart.http.HttpSettings;
import com.mchart.chart.model.ChartFetchOptions;
import com.mchart.chart.model.ChartPageResult;
import com.mchart.config.ChartProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Fetches and extracts one chart page inside an isolated worker. A page that yields no rows is
 * reported as a fetch failure, since an empty chart cannot be told apart from a broken page.
 */
@Service
public class IsolatedChartFetcher {
    private static final Logger log = LoggerFactory.getLogger(IsolatedChartFetcher.class);

    private final ChartProperties properties;
    private final CrawlWorkerLauncher launcher;

    public IsolatedChartFetcher(ChartProperties properties, CrawlWorkerLauncher launcher) {
        this.properties = properties;
        this.launcher = launcher;
    }

    public ChartPageResult fetch(ResolvedChart chart, ChartFetchOptions options) {
        String url = chartUrl(chart);
        CrawlWorkerRequest request = new CrawlWorkerRequest(
            chart.canonicalId(),
            url,
            options.includeImages(),
            options.maxEntries(),
            HttpSettings.from(properties)
        );

        Optional<CrawlWorkerResult> launched = launcher.launch(request);
        if (launched.isEmpty()) {
            throw ChartFetchException.noData(chart.canonicalId(), url);
        }
        CrawlWorkerResult result = launched.get();
        if (result.isFailure()) {
            throw new ChartFetchException(
                chart.canonicalId(),
                url,
                result.statusCode(),
                result.errorCode(),
                result.errorMessage()
            );
        }
        ChartPageResult page = result.page();
        if (page == null || !page.hasRecords()) {
            log.warn("chart page yielded no rows chart={} url={}", chart.canonicalId(), url);
            throw ChartFetchException.noData(chart.canonicalId(), url);
        }
        return page;
    }

    public String chartUrl(ResolvedChart chart) {
        return properties.getBillboard().getBaseUrl() + chart.definition().path();
    }
}
