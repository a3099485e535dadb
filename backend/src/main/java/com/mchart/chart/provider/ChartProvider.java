package com.mchart.chart.provider;

import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartEntry;
import com.mchart.chart.model.ChartFetchOptions;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * A source of music charts. Calls outside {@link #capabilities()} fail with
 * {@link com.mchart.chart.error.NotSupportedException}.
 */
public interface ChartProvider {

    String name();

    Set<ProviderCapability> capabilities();

    default boolean supports(ProviderCapability capability) {
        return capabilities().contains(capability);
    }

    ChartDocument getLatest(String chartName, ChartFetchOptions options);

    ChartDocument getChart(String chartName, LocalDate chartDate, ChartFetchOptions options);

    List<ChartDescriptor> listAvailableCharts();

    List<ChartEntry> search(String query, ChartFetchOptions options);
}
