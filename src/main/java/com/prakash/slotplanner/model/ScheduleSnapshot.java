package com.prakash.slotplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Persisted copy of the most recent {@link Schedule}. There is only ever one,
 * stored under {@link #CURRENT_ID} and overwritten on every recompute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "schedules")
public class ScheduleSnapshot {

    public static final String CURRENT_ID = "current";

    @Id
    private String id;

    private LocalDate referenceDate;
    private LocalDateTime computedAt;
    private int taskCount;
    private Map<String, Map<String, Task>> days;

    public static ScheduleSnapshot of(Schedule schedule, LocalDate referenceDate, LocalDateTime computedAt) {
        return ScheduleSnapshot.builder()
                .id(CURRENT_ID)
                .referenceDate(referenceDate)
                .computedAt(computedAt)
                .taskCount(schedule.taskCount())
                .days(schedule.getDays())
                .build();
    }
}
