package com.mchart.chart.catalog;

import com.mchart.chart.error.InvalidChartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps free-form chart names onto the canonical chart table.
 */
@Component
public class ChartNameResolver {
    private static final Logger log = LoggerFactory.getLogger(ChartNameResolver.class);

    public ResolvedChart resolve(String chartName, boolean fallbackToDefault) {
        Optional<String> canonical = canonicalId(chartName);
        if (canonical.isPresent()) {
            return new ResolvedChart(chartName, ChartCatalog.require(canonical.get()), false);
        }
        if (!fallbackToDefault) {
            throw new InvalidChartException(chartName, ChartCatalog.identifiers());
        }
        log.warn("Chart '{}' not found, falling back to {}", chartName, ChartCatalog.DEFAULT_CHART_ID);
        return new ResolvedChart(chartName, ChartCatalog.require(ChartCatalog.DEFAULT_CHART_ID), true);
    }

    public Optional<String> canonicalId(String chartName) {
        String lowered = chartName == null ? "" : chartName.trim().toLowerCase(Locale.ROOT);
        if (lowered.isEmpty()) {
            return Optional.empty();
        }
        if (ChartCatalog.find(lowered).isPresent()) {
            return Optional.of(lowered);
        }
        String hyphenated = lowered.replace(' ', '-').replace('_', '-');
        if (ChartCatalog.find(hyphenated).isPresent()) {
            return Optional.of(hyphenated);
        }
        return ChartCatalog.alias(lowered);
    }
}
