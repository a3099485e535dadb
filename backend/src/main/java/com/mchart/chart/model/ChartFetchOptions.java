package com.mchart.chart.model;

import com.mchart.config.ChartProperties;

/**
 * Per-call extraction options. A null {@code maxEntries} means no limit.
 */
public record ChartFetchOptions(boolean includeImages, Integer maxEntries, boolean fallbackToDefault) {
    public ChartFetchOptions {
        if (maxEntries != null && maxEntries <= 0) {
            maxEntries = null;
        }
    }

    public static ChartFetchOptions defaults() {
        return new ChartFetchOptions(true, null, true);
    }

    public static ChartFetchOptions from(ChartProperties properties) {
        ChartProperties.Extraction extraction = properties.getExtraction();
        return new ChartFetchOptions(
            extraction.isIncludeImages(),
            extraction.getMaxChartEntries(),
            extraction.isFallbackToDefault()
        );
    }

    public ChartFetchOptions withOverrides(Boolean includeImages, Integer maxEntries, Boolean fallbackToDefault) {
        return new ChartFetchOptions(
            includeImages == null ? this.includeImages : includeImages,
            maxEntries == null ? this.maxEntries : maxEntries,
            fallbackToDefault == null ? this.fallbackToDefault : fallbackToDefault
        );
    }
}
