package com.mchart.chart.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mchart.chart.model.ChartPageResult;

/**
 * What a worker writes to its result channel: either the parsed page or the reason the fetch failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrawlWorkerResult(
    @JsonProperty("page") ChartPageResult page,
    @JsonProperty("status_code") int statusCode,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("error_message") String errorMessage
) {
    public static CrawlWorkerResult success(ChartPageResult page, int statusCode) {
        return new CrawlWorkerResult(page, statusCode, null, null);
    }

    public static CrawlWorkerResult failure(int statusCode, String errorCode, String errorMessage) {
        return new CrawlWorkerResult(null, statusCode, errorCode, errorMessage);
    }

    @JsonIgnore
    public boolean isFailure() {
        return errorCode != null;
    }
}
