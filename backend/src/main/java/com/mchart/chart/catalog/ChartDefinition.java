package com.mchart.chart.catalog;

import com.mchart.chart.model.ChartKind;

/**
 * One row of the static chart table.
 *
 * @param fallbackDescription page description used when the page carries none; may be null
 */
public record ChartDefinition(
    String id,
    String path,
    String title,
    ChartKind kind,
    String listingDescription,
    String fallbackDescription
) {
    public String pageDescriptionFallback() {
        if (fallbackDescription != null && !fallbackDescription.isBlank()) {
            return fallbackDescription;
        }
        return "The " + id + " chart on Billboard";
    }
}
