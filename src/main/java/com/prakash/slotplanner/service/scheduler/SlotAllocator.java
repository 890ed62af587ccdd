package com.prakash.slotplanner.service.scheduler;

import com.prakash.slotplanner.exception.SchedulingConfigurationException;
import com.prakash.slotplanner.exception.TaskValidationException;
import com.prakash.slotplanner.exception.UnschedulableTaskException;
import com.prakash.slotplanner.model.Placement;
import com.prakash.slotplanner.model.Schedule;
import com.prakash.slotplanner.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Greedy first-fit allocator. Tasks are ranked with {@link TaskRanking} and placed one
 * by one into the first run of consecutive free slots at or after the cursor. When the
 * rest of the current day cannot hold a task the cursor moves to the start of the next
 * day. The cursor never moves backwards, so a slot it has passed stays empty for the
 * rest of the run.
 * <p>
 * Stateless apart from its configuration; {@link #schedule} depends only on its arguments.
 */
public class SlotAllocator {

    private static final Logger log = LoggerFactory.getLogger(SlotAllocator.class);

    public static final int DEFAULT_MAX_LOOK_AHEAD_DAYS = 365;

    private final SlotGrid grid;
    private final int maxLookAheadDays;

    public SlotAllocator(SlotGrid grid) {
        this(grid, DEFAULT_MAX_LOOK_AHEAD_DAYS);
    }

    public SlotAllocator(SlotGrid grid, int maxLookAheadDays) {
        if (grid == null) {
            throw new SchedulingConfigurationException("Slot grid is required");
        }
        if (maxLookAheadDays < 1) {
            throw new SchedulingConfigurationException("Max look-ahead days must be at least 1, got " + maxLookAheadDays);
        }
        this.grid = grid;
        this.maxLookAheadDays = maxLookAheadDays;
    }

    /**
     * Ranks and places every task, starting at the first slot of {@code referenceDate}.
     *
     * @param tasks         the task set; order only matters between tasks that tie on every ranking key
     * @param referenceDate the first day that may receive tasks
     * @return the complete schedule, empty for an empty task set
     * @throws TaskValidationException    if any task is malformed; nothing is placed
     * @throws UnschedulableTaskException if a task needs more slots than a day holds
     */
    public Schedule schedule(Collection<Task> tasks, LocalDate referenceDate) {
        if (referenceDate == null) {
            throw new TaskValidationException("A reference date is required for scheduling");
        }
        if (tasks == null || tasks.isEmpty()) {
            return Schedule.empty();
        }
        tasks.forEach(this::validate);

        List<Task> ranked = TaskRanking.rank(tasks);
        Map<LocalDate, Task[]> occupancy = new TreeMap<>();
        List<Placement> placements = new ArrayList<>(ranked.size());

        PlacementCursor cursor = PlacementCursor.startingAt(referenceDate);
        for (Task task : ranked) {
            cursor = place(task, cursor, occupancy, placements);
        }
        log.debug("Placed {} tasks across {} days starting {}", placements.size(), occupancy.size(), referenceDate);
        return toSchedule(occupancy, placements);
    }

    public SlotGrid getGrid() {
        return grid;
    }

    public int getMaxLookAheadDays() {
        return maxLookAheadDays;
    }

    /**
     * Rejects tasks that cannot be placed meaningfully. Callers are expected to have
     * validated already; this keeps a bad task from being silently mis-scheduled.
     */
    public void validate(Task task) {
        if (task == null) {
            throw new TaskValidationException("Task must not be null");
        }
        if (task.getTitle() == null || task.getTitle().isBlank()) {
            throw new TaskValidationException("Task " + task.getId() + " has a blank title");
        }
        if (task.getDuration() <= 0) {
            throw new TaskValidationException("Task '" + task.getTitle() + "' has non-positive duration: " + task.getDuration());
        }
        if (task.getImportance() == null) {
            throw new TaskValidationException("Task '" + task.getTitle() + "' has no importance");
        }
        if (task.getPriority() == null) {
            throw new TaskValidationException("Task '" + task.getTitle() + "' has no priority");
        }
        if (task.getDeadline() == null) {
            throw new TaskValidationException("Task '" + task.getTitle() + "' has no deadline");
        }
    }

    private PlacementCursor place(Task task, PlacementCursor cursor, Map<LocalDate, Task[]> occupancy,
                                  List<Placement> placements) {
        int slotsNeeded = grid.slotsNeeded(task.getDuration());
        PlacementCursor current = cursor;
        int daysAdvanced = 0;

        while (true) {
            int end = findRunEnd(occupancy.get(current.getDate()), current.getSlotIndex(), slotsNeeded);
            if (end >= 0) {
                int first = end - slotsNeeded + 1;
                Task[] day = occupancy.computeIfAbsent(current.getDate(), d -> new Task[grid.size()]);
                for (int j = first; j <= end; j++) {
                    day[j] = task;
                }
                List<String> labels = List.copyOf(grid.labels().subList(first, end + 1));
                placements.add(new Placement(task, current.getDate(), first, end, labels));
                log.debug("Placed task {} ('{}') on {} at {}-{}", task.getId(), task.getTitle(), current.getDate(),
                        grid.label(first), grid.label(end));
                return current.after(end);
            }
            if (daysAdvanced >= maxLookAheadDays) {
                throw new UnschedulableTaskException(task.getId(), task.getTitle(), slotsNeeded, grid.size(), daysAdvanced + 1);
            }
            current = current.nextDay();
            daysAdvanced++;
        }
    }

    // Grid index ending the first run of slotsNeeded free slots at or after 'from', or -1
    private int findRunEnd(Task[] day, int from, int slotsNeeded) {
        int free = 0;
        for (int i = from; i < grid.size(); i++) {
            if (day == null || day[i] == null) {
                free++;
                if (free == slotsNeeded) {
                    return i;
                }
            } else {
                free = 0;
            }
        }
        return -1;
    }

    private Schedule toSchedule(Map<LocalDate, Task[]> occupancy, List<Placement> placements) {
        Map<String, Map<String, Task>> days = new LinkedHashMap<>();
        occupancy.forEach((date, slots) -> {
            Map<String, Task> byLabel = new LinkedHashMap<>();
            for (int i = 0; i < slots.length; i++) {
                if (slots[i] != null) {
                    byLabel.put(grid.label(i), slots[i]);
                }
            }
            days.put(date.toString(), byLabel);
        });
        return new Schedule(days, placements);
    }
}
