package com.prakash.slotplanner.service;

import com.prakash.slotplanner.dto.CreateTaskRequest;
import com.prakash.slotplanner.exception.TaskNotFoundException;
import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import com.prakash.slotplanner.model.Task;
import com.prakash.slotplanner.repository.TaskRepository;
import com.prakash.slotplanner.service.scheduler.SlotAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    static final int DEFAULT_DURATION_MINUTES = 30;
    static final Importance DEFAULT_IMPORTANCE = Importance.AVERAGE;
    static final Priority DEFAULT_PRIORITY = Priority.SOFT_DEADLINE;

    private final TaskRepository taskRepository;
    private final ScheduleService scheduleService;
    private final SlotAllocator slotAllocator;

    @Autowired
    public TaskService(TaskRepository taskRepository,
                       ScheduleService scheduleService,
                       SlotAllocator slotAllocator) {
        this.taskRepository = taskRepository;
        this.scheduleService = scheduleService;
        this.slotAllocator = slotAllocator;
    }

    /**
     * Creates a task, filling unset fields with the defaults (30 minutes, Average,
     * Soft deadline, due today), and recomputes the schedule.
     * <p>
     * The new task is trial-scheduled together with the stored ones before it is saved,
     * so a task that can never be placed is rejected without being persisted. If the
     * recomputed schedule cannot be saved afterwards, the task is removed again.
     *
     * @throws com.prakash.slotplanner.exception.TaskValidationException    if the task is malformed
     * @throws com.prakash.slotplanner.exception.UnschedulableTaskException if it cannot fit in one day
     */
    public Task createTask(CreateTaskRequest request) {
        log.info("Creating new task with title: {}", request.getTitle());
        Task task = Task.builder()
                .title(request.getTitle() != null ? request.getTitle().trim() : null)
                .duration(request.getDuration() != null ? request.getDuration() : DEFAULT_DURATION_MINUTES)
                .importance(request.getImportance() != null ? request.getImportance() : DEFAULT_IMPORTANCE)
                .priority(request.getPriority() != null ? request.getPriority() : DEFAULT_PRIORITY)
                .deadline(request.getDeadline() != null ? request.getDeadline() : scheduleService.today())
                .createdAt(scheduleService.now())
                .build();
        slotAllocator.validate(task);

        return scheduleService.applyTaskSetChange(() -> {
            // Stored tasks in creation order, the new one last, as it will be on the next recompute
            List<Task> candidates = new ArrayList<>(taskRepository.findAllByOrderByCreatedAtAscIdAsc());
            candidates.add(task);
            scheduleService.preview(candidates, scheduleService.today());

            Task saved = taskRepository.save(task);
            log.info("Task {} saved ({} min, {}, {}, due {})", saved.getId(), saved.getDuration(),
                    saved.getPriority(), saved.getImportance(), saved.getDeadline());
            return saved;
        }, saved -> {
            log.warn("Removing task {} because the schedule could not be saved", saved.getId());
            taskRepository.deleteById(saved.getId());
        });
    }

    public List<Task> getAllTasks() {
        log.debug("Fetching all tasks");
        return taskRepository.findAllByOrderByCreatedAtAscIdAsc();
    }

    public List<Task> getTasks(Importance importance, Priority priority) {
        log.debug("Fetching tasks. Importance: {}, priority: {}", importance, priority);
        if (importance != null && priority != null) {
            return taskRepository.findByPriorityAndImportance(priority, importance);
        }
        if (importance != null) {
            return taskRepository.findByImportance(importance);
        }
        if (priority != null) {
            return taskRepository.findByPriority(priority);
        }
        return getAllTasks();
    }

    public Task getTaskById(String id) {
        log.debug("Fetching task by ID: {}", id);
        return taskRepository.findById(id)
                .orElseThrow(() -> new TaskNotFoundException("Task not found with ID: " + id));
    }

    /**
     * Deletes a task and recomputes the schedule. Removing the last task leaves an empty schedule.
     * The task is restored if the new schedule cannot be saved.
     */
    public void deleteTask(String id) {
        scheduleService.applyTaskSetChange(() -> {
            Task existing = taskRepository.findById(id)
                    .orElseThrow(() -> new TaskNotFoundException("Task not found with ID: " + id));
            log.warn("Deleting task with ID: {}", id);
            taskRepository.deleteById(id);
            return existing;
        }, deleted -> {
            log.warn("Restoring task {} because the schedule could not be saved", deleted.getId());
            taskRepository.save(deleted);
        });
    }
}
