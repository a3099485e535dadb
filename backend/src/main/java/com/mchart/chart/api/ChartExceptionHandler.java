package com.mchart.chart.api;

import com.mchart.chart.error.ChartFetchException;
import com.mchart.chart.error.ChartValidationException;
import com.mchart.chart.error.InvalidChartException;
import com.mchart.chart.error.NotSupportedException;
import com.mchart.chart.error.UnknownProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ChartExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ChartExceptionHandler.class);

    @ExceptionHandler(InvalidChartException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidChart(InvalidChartException ex) {
        Map<String, Object> body = body(ex.errorCode(), ex.getMessage());
        body.put("requested", ex.getRequested());
        body.put("valid_charts", ex.getValidIdentifiers());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownProvider(UnknownProviderException ex) {
        Map<String, Object> body = body(ex.errorCode(), ex.getMessage());
        body.put("requested", ex.getRequested());
        body.put("available_providers", ex.getAvailableProviders());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(NotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleNotSupported(NotSupportedException ex) {
        Map<String, Object> body = body(ex.errorCode(), ex.getMessage());
        body.put("provider", ex.getProvider());
        body.put("capability", ex.getCapability().name());
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(body);
    }

    @ExceptionHandler(ChartFetchException.class)
    public ResponseEntity<Map<String, Object>> handleFetchFailure(ChartFetchException ex) {
        log.warn("chart fetch failed chart={} url={} status={} fetchError={}",
            ex.getChartId(), ex.getUrl(), ex.getStatusCode(), ex.getFetchErrorCode());
        Map<String, Object> body = body(ex.errorCode(), ex.getMessage());
        body.put("chart", ex.getChartId());
        body.put("url", ex.getUrl());
        body.put("status_code", ex.getStatusCode());
        body.put("fetch_error", ex.getFetchErrorCode());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ChartValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationFailure(ChartValidationException ex) {
        log.error("assembled chart failed validation: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body(ex.errorCode(), ex.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
