package com.prakash.slotplanner.service;

import com.prakash.slotplanner.model.Schedule;
import com.prakash.slotplanner.model.ScheduleSnapshot;
import com.prakash.slotplanner.model.Task;
import com.prakash.slotplanner.repository.ScheduleSnapshotRepository;
import com.prakash.slotplanner.repository.TaskRepository;
import com.prakash.slotplanner.service.scheduler.SlotAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs the allocator over the stored task set and keeps the persisted snapshot in step
 * with it. Task-set changes and recomputes are serialised through one lock so every
 * run sees a consistent copy of the tasks.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final TaskRepository taskRepository;
    private final ScheduleSnapshotRepository snapshotRepository;
    private final SlotAllocator slotAllocator;
    private final Clock clock;

    private final ReentrantLock taskSetLock = new ReentrantLock();

    @Autowired
    public ScheduleService(TaskRepository taskRepository,
                           ScheduleSnapshotRepository snapshotRepository,
                           SlotAllocator slotAllocator,
                           Clock clock) {
        this.taskRepository = taskRepository;
        this.snapshotRepository = snapshotRepository;
        this.slotAllocator = slotAllocator;
        this.clock = clock;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Computes a schedule for the given tasks without touching the store.
     */
    public Schedule preview(Collection<Task> tasks, LocalDate referenceDate) {
        return slotAllocator.schedule(new ArrayList<>(tasks), referenceDate);
    }

    /**
     * Recomputes from the stored tasks, anchored at today.
     */
    public ScheduleSnapshot recompute() {
        return recompute(today());
    }

    /**
     * Recomputes from the stored tasks and replaces the persisted snapshot.
     *
     * @param referenceDate first day that may receive tasks
     * @return the snapshot that was saved
     */
    public ScheduleSnapshot recompute(LocalDate referenceDate) {
        taskSetLock.lock();
        try {
            List<Task> tasks = new ArrayList<>(taskRepository.findAllByOrderByCreatedAtAscIdAsc());
            log.info("Recomputing schedule for {} tasks from {}", tasks.size(), referenceDate);
            Schedule schedule = slotAllocator.schedule(tasks, referenceDate);
            ScheduleSnapshot snapshot = snapshotRepository.save(ScheduleSnapshot.of(schedule, referenceDate, now()));
            log.info("Schedule recomputed: {}", schedule);
            return snapshot;
        } finally {
            taskSetLock.unlock();
        }
    }

    /**
     * Returns the persisted snapshot. A fresh one is computed and saved when none exists
     * yet or when the stored one is anchored before today, so days already over are never served.
     */
    public ScheduleSnapshot getCurrentSchedule() {
        Optional<ScheduleSnapshot> stored = snapshotRepository.findById(ScheduleSnapshot.CURRENT_ID);
        if (stored.isEmpty()) {
            log.info("No persisted schedule found. Computing one now.");
            return recompute();
        }
        LocalDate today = today();
        ScheduleSnapshot snapshot = stored.get();
        if (snapshot.getReferenceDate() == null || snapshot.getReferenceDate().isBefore(today)) {
            log.info("Persisted schedule is anchored at {}, before {}. Recomputing.", snapshot.getReferenceDate(), today);
            return recompute(today);
        }
        return snapshot;
    }

    /**
     * Applies a change to the task set and recomputes the schedule while holding the
     * task-set lock. If the change throws, nothing is recomputed. If the recompute
     * throws, {@code undo} is given the change's result to revert it and the failure is rethrown,
     * so a change is only kept when its schedule was saved.
     */
    public <T> T applyTaskSetChange(Supplier<T> change, Consumer<T> undo) {
        taskSetLock.lock();
        try {
            T result = change.get();
            try {
                recompute();
            } catch (RuntimeException e) {
                log.error("Recompute failed after task-set change, reverting it: {}", e.getMessage());
                try {
                    undo.accept(result);
                } catch (RuntimeException undoError) {
                    log.error("Failed to revert task-set change: {}", undoError.getMessage(), undoError);
                    e.addSuppressed(undoError);
                }
                throw e;
            }
            return result;
        } finally {
            taskSetLock.unlock();
        }
    }

    public List<String> slotLabels() {
        return slotAllocator.getGrid().labels();
    }
}
