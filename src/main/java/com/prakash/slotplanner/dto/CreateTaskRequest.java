package com.prakash.slotplanner.dto;

import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

// Only the title is required; the rest falls back to the form defaults in TaskService
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "Task title cannot be blank.")
    @Size(max = 100, message = "Task title cannot exceed 100 characters.")
    private String title;

    @Min(value = 1, message = "Task duration must be at least 1 minute.")
    @Max(value = 1440, message = "Task duration cannot exceed 1440 minutes.")
    private Integer duration;

    private Importance importance;

    private Priority priority;

    private LocalDate deadline;
}
