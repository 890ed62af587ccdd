package com.prakash.slotplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(value = HttpStatus.INTERNAL_SERVER_ERROR) // Normally surfaces at startup, not per request
public class SchedulingConfigurationException extends RuntimeException {

    public SchedulingConfigurationException(String message) {
        super(message);
    }
}
