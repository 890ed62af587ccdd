package com.prakash.slotplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A task that must not reach placement: blank title, non-positive duration,
 * or a missing importance, priority or deadline.
 */
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class TaskValidationException extends RuntimeException {

    public TaskValidationException(String message) {
        super(message);
    }
}
