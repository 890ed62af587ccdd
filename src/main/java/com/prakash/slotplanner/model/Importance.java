package com.prakash.slotplanner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much a task matters. Ranked after {@link Priority} and before the deadline.
 */
public enum Importance {
    ASAP("ASAP", 0),
    HIGH("High", 1),
    AVERAGE("Average", 2),
    LOW("Low", 3);

    private final String label;
    private final int rank;

    Importance(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    // Lower rank is scheduled first
    public int getRank() {
        return rank;
    }

    /**
     * Resolves either the display label ("High") or the constant name ("HIGH").
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static Importance fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (Importance importance : values()) {
                if (importance.label.equalsIgnoreCase(trimmed) || importance.name().equalsIgnoreCase(trimmed)) {
                    return importance;
                }
            }
        }
        throw new IllegalArgumentException("Unrecognized importance: " + value);
    }
}
