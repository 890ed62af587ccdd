package com.prakash.slotplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "tasks")
public class Task {

    @Id
    private String id; // ObjectId hex, time-derived and unique

    private String title;
    private int duration; // minutes
    private Importance importance;
    private Priority priority;
    private LocalDate deadline;
    private LocalDateTime createdAt;
}
