package com.mchart.chart.error;

import com.mchart.chart.provider.ProviderCapability;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_IMPLEMENTED)
public class NotSupportedException extends ChartException {
    private final String provider;
    private final ProviderCapability capability;

    public NotSupportedException(String provider, ProviderCapability capability, String message) {
        super(message);
        this.provider = provider;
        this.capability = capability;
    }

    public String getProvider() {
        return provider;
    }

    public ProviderCapability getCapability() {
        return capability;
    }

    @Override
    public String errorCode() {
        return "not_supported";
    }
}
