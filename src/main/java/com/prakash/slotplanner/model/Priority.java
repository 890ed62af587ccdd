package com.prakash.slotplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deadline class of a task. This is the primary ranking key; it is unrelated to
 * {@link Importance} even though both have an ASAP level.
 */
public enum Priority {
    ASAP("ASAP", 0),
    HARD_DEADLINE("Hard deadline", 1),
    SOFT_DEADLINE("Soft deadline", 2),
    NO_DEADLINE("No deadline", 3);

    private final String label;
    private final int rank;

    Priority(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Resolves the display label ("Hard deadline") or the constant name ("HARD_DEADLINE").
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static Priority fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (Priority priority : values()) {
                if (priority.label.equalsIgnoreCase(trimmed) || priority.name().equalsIgnoreCase(trimmed)) {
                    return priority;
                }
            }
        }
        throw new IllegalArgumentException("Unrecognized priority: " + value);
    }
}
