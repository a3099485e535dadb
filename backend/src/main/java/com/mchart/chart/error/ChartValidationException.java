package com.mchart.chart.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * An assembled chart broke one of the model invariants. Always an extraction bug, never bad input.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class ChartValidationException extends ChartException {
    public ChartValidationException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "validation_failure";
    }
}
