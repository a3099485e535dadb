package com.mchart.chart.provider;

import com.mchart.chart.error.NotSupportedException;
import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartEntry;
import com.mchart.chart.model.ChartFetchOptions;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Checks the capability set before dispatching, so unsupported calls fail the same way for every provider.
 */
public abstract class AbstractChartProvider implements ChartProvider {

    @Override
    public final ChartDocument getLatest(String chartName, ChartFetchOptions options) {
        requireCapability(ProviderCapability.LATEST);
        return doGetLatest(chartName, options == null ? ChartFetchOptions.defaults() : options);
    }

    @Override
    public final ChartDocument getChart(String chartName, LocalDate chartDate, ChartFetchOptions options) {
        requireCapability(ProviderCapability.HISTORICAL);
        return doGetChart(chartName, chartDate, options == null ? ChartFetchOptions.defaults() : options);
    }

    @Override
    public final List<ChartDescriptor> listAvailableCharts() {
        requireCapability(ProviderCapability.LIST_CHARTS);
        return doListAvailableCharts();
    }

    @Override
    public final List<ChartEntry> search(String query, ChartFetchOptions options) {
        requireCapability(ProviderCapability.SEARCH);
        return doSearch(query, options == null ? ChartFetchOptions.defaults() : options);
    }

    protected abstract ChartDocument doGetLatest(String chartName, ChartFetchOptions options);

    protected ChartDocument doGetChart(String chartName, LocalDate chartDate, ChartFetchOptions options) {
        throw unsupported(ProviderCapability.HISTORICAL);
    }

    protected abstract List<ChartDescriptor> doListAvailableCharts();

    protected List<ChartEntry> doSearch(String query, ChartFetchOptions options) {
        throw unsupported(ProviderCapability.SEARCH);
    }

    protected void requireCapability(ProviderCapability capability) {
        if (!supports(capability)) {
            throw unsupported(capability);
        }
    }

    protected NotSupportedException unsupported(ProviderCapability capability) {
        return new NotSupportedException(
            name(),
            capability,
            "Provider " + name() + " does not support " + capability.name().toLowerCase(Locale.ROOT).replace('_', ' ')
        );
    }
}
