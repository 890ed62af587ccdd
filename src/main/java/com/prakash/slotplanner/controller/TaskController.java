package com.prakash.slotplanner.controller;

import com.prakash.slotplanner.dto.CreateTaskRequest;
import com.prakash.slotplanner.dto.TaskResponse;
import com.prakash.slotplanner.exception.TaskNotFoundException;
import com.prakash.slotplanner.exception.TaskValidationException;
import com.prakash.slotplanner.exception.UnschedulableTaskException;
import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import com.prakash.slotplanner.model.Task;
import com.prakash.slotplanner.service.TaskService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/tasks") // Base path for task-related endpoints
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;

    @Autowired
    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    /**
     * Endpoint to create a new task. The schedule is recomputed as part of the call.
     *
     * @param request title plus optional duration, importance, priority and deadline
     * @return the created task (201), 400 for an invalid task, 422 if it can never be placed
     */
    @PostMapping
    public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("Received request to create task: {}", request.getTitle());
        try {
            Task createdTask = taskService.createTask(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.fromEntity(createdTask));
        } catch (TaskValidationException | UnschedulableTaskException e) {
            // These have @ResponseStatus, so re-throwing allows default handling (400, 422)
            log.warn("Failed to create task '{}': {}", request.getTitle(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error creating task '{}': {}", request.getTitle(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    /**
     * Endpoint to list tasks, optionally filtered by importance and/or priority.
     * Filters accept the display label ("Hard deadline") or the constant name.
     */
    @GetMapping
    public ResponseEntity<List<TaskResponse>> getTasks(
            @RequestParam(required = false) String importance,
            @RequestParam(required = false) String priority) {
        log.debug("Received request to get tasks. Importance: {}, priority: {}", importance, priority);
        try {
            Importance importanceFilter = importance != null ? Importance.fromValue(importance) : null;
            Priority priorityFilter = priority != null ? Priority.fromValue(priority) : null;
            List<TaskResponse> responseDtos = taskService.getTasks(importanceFilter, priorityFilter).stream()
                    .map(TaskResponse::fromEntity)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(responseDtos);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid task filter: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTaskById(@PathVariable String id) {
        log.debug("Received request to get task by ID: {}", id);
        // TaskNotFoundException is mapped to 404 by its @ResponseStatus
        Task task = taskService.getTaskById(id);
        return ResponseEntity.ok(TaskResponse.fromEntity(task));
    }

    /**
     * Endpoint to delete a task by its ID. The schedule is recomputed without it.
     *
     * @return 204 on success, 404 if the task does not exist
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTask(@PathVariable String id) {
        log.info("Received request to delete task by ID: {}", id);
        try {
            taskService.deleteTask(id);
            return ResponseEntity.noContent().build();
        } catch (TaskNotFoundException e) {
            log.warn("Cannot delete task: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error deleting task {}: {}", id, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
