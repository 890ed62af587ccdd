package com.prakash.slotplanner.dto;

import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import com.prakash.slotplanner.model.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResponse {

    private String id;
    private String title;
    private int duration;
    private Importance importance;
    private Priority priority;
    private LocalDate deadline;
    private LocalDateTime createdAt;

    // Factory method to convert Task entity to TaskResponse DTO
    public static TaskResponse fromEntity(Task task) {
        if (task == null) {
            return null;
        }
        return TaskResponse.builder()
                .id(task.getId())
                .title(task.getTitle())
                .duration(task.getDuration())
                .importance(task.getImportance())
                .priority(task.getPriority())
                .deadline(task.getDeadline())
                .createdAt(task.getCreatedAt())
                .build();
    }
}
