package com.mchart.chart.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidChartException extends ChartException {
    private final String requested;
    private final List<String> validIdentifiers;

    public InvalidChartException(String requested, List<String> validIdentifiers) {
        super("Unknown chart: " + requested + ". Available: " + validIdentifiers);
        this.requested = requested;
        this.validIdentifiers = List.copyOf(validIdentifiers);
    }

    public String getRequested() {
        return requested;
    }

    public List<String> getValidIdentifiers() {
        return validIdentifiers;
    }

    @Override
    public String errorCode() {
        return "invalid_chart";
    }
}
