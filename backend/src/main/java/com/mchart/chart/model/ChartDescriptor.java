package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChartDescriptor(
    @JsonProperty("source") String source,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("url") String url,
    @JsonProperty("kind") ChartKind kind
) {
    public ChartDescriptor {
        description = description == null ? "" : description;
        url = url == null ? "" : url;
        kind = kind == null ? ChartKind.SINGLE : kind;
    }
}
