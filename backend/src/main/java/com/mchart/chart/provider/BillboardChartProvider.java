package com.mchart.chart.provider;

import com.mchart.chart.assembly.ChartAssembler;
import com.mchart.chart.catalog.ChartCatalog;
import com.mchart.chart.catalog.ChartDefinition;
import com.mchart.chart.catalog.ChartNameResolver;
import com.mchart.chart.catalog.ResolvedChart;
import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartFetchOptions;
import com.mchart.chart.model.ChartPageResult;
import com.mchart.chart.worker.IsolatedChartFetcher;
import com.mchart.config.ChartProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scrapes the latest Billboard charts. Billboard pages only show the current week, so historical
 * lookups are not offered.
 */
@Service
public class BillboardChartProvider extends AbstractChartProvider {
    private static final Logger log = LoggerFactory.getLogger(BillboardChartProvider.class);
    public static final String NAME = "billboard";

    private final ChartNameResolver resolver;
    private final IsolatedChartFetcher fetcher;
    private final ChartAssembler assembler;
    private final ChartProperties properties;

    public BillboardChartProvider(
        ChartNameResolver resolver,
        IsolatedChartFetcher fetcher,
        ChartAssembler assembler,
        ChartProperties properties
    ) {
        this.resolver = resolver;
        this.fetcher = fetcher;
        this.assembler = assembler;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return EnumSet.of(ProviderCapability.LATEST, ProviderCapability.LIST_CHARTS);
    }

    @Override
    protected ChartDocument doGetLatest(String chartName, ChartFetchOptions options) {
        ResolvedChart chart = resolver.resolve(chartName, options.fallbackToDefault());
        ChartPageResult page = fetcher.fetch(chart, options);
        ChartDocument document = assembler.assemble(NAME, chart, page, options.maxEntries());
        log.info(
            "assembled chart={} requested={} entries={} publishedDate={}",
            chart.canonicalId(),
            chartName,
            document.totalEntries(),
            document.publishedDate()
        );
        return document;
    }

    @Override
    protected List<ChartDescriptor> doListAvailableCharts() {
        String baseUrl = properties.getBillboard().getBaseUrl();
        return ChartCatalog.definitions().stream()
            .map(definition -> describe(definition, baseUrl))
            .toList();
    }

    private static ChartDescriptor describe(ChartDefinition definition, String baseUrl) {
        return new ChartDescriptor(
            NAME,
            definition.title(),
            definition.listingDescription(),
            baseUrl + definition.path(),
            definition.kind()
        );
    }
}
