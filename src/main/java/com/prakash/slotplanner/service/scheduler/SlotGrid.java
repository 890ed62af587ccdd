package com.prakash.slotplanner.service.scheduler;

import com.prakash.slotplanner.exception.SchedulingConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered half-hour slots of one working day, labelled {@code H:MM} with an
 * unpadded 24-hour hour ({@code 9:00, 9:30, ... 16:30} for the default 9 to 17 grid).
 * Immutable.
 */
public final class SlotGrid {

    public static final int SLOT_LENGTH_MINUTES = 30;
    public static final int DEFAULT_START_HOUR = 9;
    public static final int DEFAULT_END_HOUR = 17;

    private final int startHour;
    private final int endHour;
    private final List<String> labels;

    private SlotGrid(int startHour, int endHour, List<String> labels) {
        this.startHour = startHour;
        this.endHour = endHour;
        this.labels = labels;
    }

    public static SlotGrid defaultGrid() {
        return of(DEFAULT_START_HOUR, DEFAULT_END_HOUR);
    }

    /**
     * Builds the grid for hours {@code [startHour, endHour)}.
     *
     * @throws SchedulingConfigurationException if the bounds are outside 0..24 or
     *                                          {@code endHour <= startHour}
     */
    public static SlotGrid of(int startHour, int endHour) {
        return new SlotGrid(startHour, endHour, generateLabels(startHour, endHour));
    }

    /**
     * Generates the slot labels two per hour, {@code "<h>:00"} then {@code "<h>:30"}.
     */
    public static List<String> generateLabels(int startHour, int endHour) {
        if (startHour < 0 || endHour > 24) {
            throw new SchedulingConfigurationException(
                    "Slot grid hours must lie within 0..24, got " + startHour + ".." + endHour);
        }
        if (endHour <= startHour) {
            throw new SchedulingConfigurationException(
                    "Slot grid end hour (" + endHour + ") must be after start hour (" + startHour + ")");
        }
        List<String> slots = new ArrayList<>((endHour - startHour) * 2);
        for (int hour = startHour; hour < endHour; hour++) {
            slots.add(hour + ":00");
            slots.add(hour + ":30");
        }
        return Collections.unmodifiableList(slots);
    }

    /**
     * Slots a task of the given length occupies. Partial slots round up.
     */
    public int slotsNeeded(int durationMinutes) {
        return (int) Math.floorDiv(durationMinutes + (long) SLOT_LENGTH_MINUTES - 1, SLOT_LENGTH_MINUTES);
    }

    public int size() {
        return labels.size();
    }

    public String label(int index) {
        return labels.get(index);
    }

    public List<String> labels() {
        return labels;
    }

    public int slotLengthMinutes() {
        return SLOT_LENGTH_MINUTES;
    }

    public int getStartHour() {
        return startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    @Override
    public String toString() {
        return "SlotGrid[" + startHour + ".." + endHour + ", " + labels.size() + " slots]";
    }
}
