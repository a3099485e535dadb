package com.mchart.chart.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one crawl pulled out of a chart page, before assembly.
 */
public record ChartPageResult(
    @JsonProperty("chart_id") String chartId,
    @JsonProperty("url") String url,
    @JsonProperty("published_date") LocalDate publishedDate,
    @JsonProperty("description") String description,
    @JsonProperty("records") List<RawChartRecord> records
) {
    public ChartPageResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
