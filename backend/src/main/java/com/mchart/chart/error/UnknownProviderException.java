package com.mchart.chart.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnknownProviderException extends ChartException {
    private final String requested;
    private final List<String> availableProviders;

    public UnknownProviderException(String requested, List<String> availableProviders) {
        super("Provider '" + requested + "' is not available. Available providers: " + availableProviders);
        this.requested = requested;
        this.availableProviders = List.copyOf(availableProviders);
    }

    public String getRequested() {
        return requested;
    }

    public List<String> getAvailableProviders() {
        return availableProviders;
    }

    @Override
    public String errorCode() {
        return "unknown_provider";
    }
}
