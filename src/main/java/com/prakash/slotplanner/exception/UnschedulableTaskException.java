package com.prakash.slotplanner.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Raised when a task could not be placed within the look-ahead window, which only
 * happens when it needs more slots than one day's grid holds.
 */
@ResponseStatus(value = HttpStatus.UNPROCESSABLE_ENTITY)
public class UnschedulableTaskException extends RuntimeException {

    private final String taskId;
    private final int slotsNeeded;
    private final int slotsPerDay;

    public UnschedulableTaskException(String taskId, String title, int slotsNeeded, int slotsPerDay, int daysScanned) {
        super(String.format("Task '%s' (ID: %s) needs %d consecutive slots but a day only has %d; gave up after %d days",
                title, taskId, slotsNeeded, slotsPerDay, daysScanned));
        this.taskId = taskId;
        this.slotsNeeded = slotsNeeded;
        this.slotsPerDay = slotsPerDay;
    }

    public String getTaskId() {
        return taskId;
    }

    public int getSlotsNeeded() {
        return slotsNeeded;
    }

    public int getSlotsPerDay() {
        return slotsPerDay;
    }
}
