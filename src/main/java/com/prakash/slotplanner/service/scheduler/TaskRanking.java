package com.prakash.slotplanner.service.scheduler;

import com.prakash.slotplanner.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Total order used before placement: priority, then importance, then the earlier deadline.
 */
public final class TaskRanking {

    private static final Comparator<Task> ORDER = Comparator
            .comparingInt((Task task) -> task.getPriority().getRank())
            .thenComparingInt(task -> task.getImportance().getRank())
            .thenComparing(Task::getDeadline);

    private TaskRanking() {
    }

    public static Comparator<Task> comparator() {
        return ORDER;
    }

    /**
     * Returns a ranked copy. {@link List#sort} is stable, so full ties keep input order.
     */
    public static List<Task> rank(Collection<Task> tasks) {
        List<Task> ranked = new ArrayList<>(tasks);
        ranked.sort(ORDER);
        return ranked;
    }
}
