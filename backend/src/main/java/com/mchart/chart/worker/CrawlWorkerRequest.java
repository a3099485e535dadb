package com.mchart.chart.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mchart.chart.http.HttpSettings;

public record CrawlWorkerRequest(
    @JsonProperty("chart_id") String chartId,
    @JsonProperty("url") String url,
    @JsonProperty("include_images") boolean includeImages,
    @JsonProperty("max_entries") Integer maxEntries,
    @JsonProperty("http") HttpSettings http
) {
}
