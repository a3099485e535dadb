package com.mchart.chart.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The page could not be fetched, or the fetch produced no usable rows. Retryable by calling again.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class ChartFetchException extends ChartException {
    public static final String NO_DATA = "no_data";

    private final String chartId;
    private final String url;
    private final int statusCode;
    private final String fetchErrorCode;

    public ChartFetchException(String chartId, String url, int statusCode, String fetchErrorCode, String message) {
        this(chartId, url, statusCode, fetchErrorCode, message, null);
    }

    public ChartFetchException(
        String chartId,
        String url,
        int statusCode,
        String fetchErrorCode,
        String message,
        Throwable cause
    ) {
        super("Failed to fetch chart " + chartId + " from " + url + ": " + message, cause);
        this.chartId = chartId;
        this.url = url;
        this.statusCode = statusCode;
        this.fetchErrorCode = fetchErrorCode;
    }

    public static ChartFetchException noData(String chartId, String url) {
        return new ChartFetchException(chartId, url, 0, NO_DATA, "no data returned");
    }

    public String getChartId() {
        return chartId;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getFetchErrorCode() {
        return fetchErrorCode;
    }

    @Override
    public String errorCode() {
        return "fetch_failure";
    }
}
