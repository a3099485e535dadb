package com.mchart.chart.api;

import com.mchart.chart.model.ChartDescriptor;
import com.mchart.chart.model.ChartDocument;
import com.mchart.chart.model.ChartFetchOptions;
import com.mchart.chart.provider.ChartProvider;
import com.mchart.chart.provider.ChartProviderRegistry;
import com.mchart.config.ChartProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/charts")
public class ChartController {
    private final ChartProviderRegistry providerRegistry;
    private final ChartProperties chartProperties;

    public ChartController(ChartProviderRegistry providerRegistry, ChartProperties chartProperties) {
        this.providerRegistry = providerRegistry;
        this.chartProperties = chartProperties;
    }

    @GetMapping("/providers")
    public List<String> providers() {
        return providerRegistry.names();
    }

    @GetMapping("/{provider}")
    public List<ChartDescriptor> listCharts(@PathVariable("provider") String provider) {
        return providerRegistry.get(provider).listAvailableCharts();
    }

    @GetMapping("/{provider}/{chart}")
    public ChartDocument latest(
        @PathVariable("provider") String provider,
        @PathVariable("chart") String chart,
        @RequestParam(name = "includeImages", required = false) Boolean includeImages,
        @RequestParam(name = "maxEntries", required = false) Integer maxEntries,
        @RequestParam(name = "fallback", required = false) Boolean fallback
    ) {
        ChartProvider chartProvider = providerRegistry.get(provider);
        return chartProvider.getLatest(chart, options(includeImages, maxEntries, fallback));
    }

    @GetMapping("/{provider}/{chart}/history/{date}")
    public ChartDocument history(
        @PathVariable("provider") String provider,
        @PathVariable("chart") String chart,
        @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
        @RequestParam(name = "includeImages", required = false) Boolean includeImages,
        @RequestParam(name = "maxEntries", required = false) Integer maxEntries
    ) {
        ChartProvider chartProvider = providerRegistry.get(provider);
        return chartProvider.getChart(chart, date, options(includeImages, maxEntries, null));
    }

    private ChartFetchOptions options(Boolean includeImages, Integer maxEntries, Boolean fallback) {
        return ChartFetchOptions.from(chartProperties).withOverrides(includeImages, maxEntries, fallback);
    }
}
