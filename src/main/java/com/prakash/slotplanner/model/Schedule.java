package com.prakash.slotplanner.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one scheduling run: ISO date ({@code YYYY-MM-DD}) to slot label to the
 * task occupying that slot. A task spanning N slots is listed under N consecutive
 * labels. Dates are in ascending order and slots in grid order.
 * <p>
 * A schedule is a derived view of the task set; it is rebuilt from scratch whenever
 * the set changes and is never edited in place.
 */
public final class Schedule {

    private static final Schedule EMPTY = new Schedule(Map.of(), List.of());

    private final Map<String, Map<String, Task>> days;
    private final List<Placement> placements;

    public Schedule(Map<String, Map<String, Task>> days, List<Placement> placements) {
        Map<String, Map<String, Task>> copy = new LinkedHashMap<>();
        days.forEach((date, slots) -> copy.put(date, Collections.unmodifiableMap(new LinkedHashMap<>(slots))));
        this.days = Collections.unmodifiableMap(copy);
        this.placements = List.copyOf(placements);
    }

    public static Schedule empty() {
        return EMPTY;
    }

    public Map<String, Map<String, Task>> getDays() {
        return days;
    }

    /**
     * Slots taken on the given date, or an empty map when nothing was placed there.
     */
    public Map<String, Task> slotsOn(LocalDate date) {
        return days.getOrDefault(date.toString(), Map.of());
    }

    /**
     * Placements in the order tasks were placed, which is ranking order.
     */
    public List<Placement> getPlacements() {
        return placements;
    }

    public Optional<Placement> placementOf(String taskId) {
        return placements.stream()
                .filter(p -> taskId.equals(p.getTask().getId()))
                .findFirst();
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }

    public int taskCount() {
        return placements.size();
    }

    @Override
    public String toString() {
        return "Schedule[" + placements.size() + " tasks over " + days.size() + " days]";
    }
}
