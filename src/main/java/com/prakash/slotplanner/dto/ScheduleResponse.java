package com.prakash.slotplanner.dto;

import com.prakash.slotplanner.model.ScheduleSnapshot;
import com.prakash.slotplanner.model.Task;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduleResponse {

    private LocalDate referenceDate;
    private LocalDateTime computedAt;
    private int taskCount;
    private Map<String, Map<String, TaskResponse>> days; // date -> slot label -> task

    public static ScheduleResponse fromSnapshot(ScheduleSnapshot snapshot) {
        return fromSnapshot(snapshot, date -> true);
    }

    /**
     * Converts a snapshot, keeping only the dates accepted by {@code dateFilter}.
     * Date and slot order are preserved.
     */
    public static ScheduleResponse fromSnapshot(ScheduleSnapshot snapshot, Predicate<String> dateFilter) {
        if (snapshot == null) {
            return null;
        }
        Map<String, Map<String, TaskResponse>> days = new LinkedHashMap<>();
        if (snapshot.getDays() != null) {
            snapshot.getDays().forEach((date, slots) -> {
                if (!dateFilter.test(date)) {
                    return;
                }
                Map<String, TaskResponse> bySlot = new LinkedHashMap<>();
                for (Map.Entry<String, Task> entry : slots.entrySet()) {
                    bySlot.put(entry.getKey(), TaskResponse.fromEntity(entry.getValue()));
                }
                days.put(date, bySlot);
            });
        }
        return ScheduleResponse.builder()
                .referenceDate(snapshot.getReferenceDate())
                .computedAt(snapshot.getComputedAt())
                .taskCount(snapshot.getTaskCount())
                .days(days)
                .build();
    }
}
