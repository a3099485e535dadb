package com.mchart.chart.catalog;

import com.mchart.chart.model.ChartKind;

/**
 * @param fellBack true when the requested name was unknown and the default chart was substituted
 */
public record ResolvedChart(String requested, ChartDefinition definition, boolean fellBack) {
    public String canonicalId() {
        return definition.id();
    }

    public ChartKind kind() {
        return definition.kind();
    }
}
