package com.prakash.slotplanner.service;

import com.prakash.slotplanner.exception.TaskValidationException;
import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import com.prakash.slotplanner.model.ScheduleSnapshot;
import com.prakash.slotplanner.model.Task;
import com.prakash.slotplanner.repository.ScheduleSnapshotRepository;
import com.prakash.slotplanner.repository.TaskRepository;
import com.prakash.slotplanner.service.scheduler.SlotAllocator;
import com.prakash.slotplanner.service.scheduler.SlotGrid;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:15:30Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private ScheduleSnapshotRepository snapshotRepository;

    private ScheduleService scheduleService;

    @BeforeEach
    void setUp() {
        scheduleService = new ScheduleService(taskRepository, snapshotRepository,
                new SlotAllocator(SlotGrid.defaultGrid()), CLOCK);
    }

    private static Task task(String id, int duration, Priority priority) {
        return Task.builder()
                .id(id)
                .title("Task " + id)
                .duration(duration)
                .priority(priority)
                .importance(Importance.AVERAGE)
                .deadline(TODAY)
                .build();
    }

    @Test
    @DisplayName("today comes from the injected clock")
    void today_fromClock() {
        assertEquals(TODAY, scheduleService.today());
        assertEquals(LocalDateTime.of(2026, 10, 19, 10, 15, 30), scheduleService.now());
    }

    @Test
    @DisplayName("recompute schedules the stored tasks and saves the current snapshot")
    void recompute_savesSnapshot() {
        Task later = task("later", 60, Priority.NO_DEADLINE);
        Task first = task("first", 30, Priority.ASAP);
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(later, first));
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        ScheduleSnapshot snapshot = scheduleService.recompute();

        assertEquals(ScheduleSnapshot.CURRENT_ID, snapshot.getId());
        assertEquals(TODAY, snapshot.getReferenceDate());
        assertEquals(LocalDateTime.of(2026, 10, 19, 10, 15, 30), snapshot.getComputedAt());
        assertEquals(2, snapshot.getTaskCount());
        assertSame(first, snapshot.getDays().get("2026-10-19").get("9:00"));
        assertSame(later, snapshot.getDays().get("2026-10-19").get("9:30"));
        assertSame(later, snapshot.getDays().get("2026-10-19").get("10:00"));
    }

    @Test
    @DisplayName("recompute can replay from another reference date")
    void recompute_explicitReferenceDate() {
        LocalDate replay = LocalDate.of(2026, 12, 1);
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(task("a", 30, Priority.ASAP)));
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        ScheduleSnapshot snapshot = scheduleService.recompute(replay);

        assertEquals(replay, snapshot.getReferenceDate());
        assertTrue(snapshot.getDays().containsKey("2026-12-01"));
    }

    @Test
    @DisplayName("an empty task store produces an empty snapshot")
    void recompute_emptyStore() {
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of());
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        ScheduleSnapshot snapshot = scheduleService.recompute();

        assertTrue(snapshot.getDays().isEmpty());
        assertEquals(0, snapshot.getTaskCount());
    }

    @Test
    @DisplayName("the persisted snapshot is returned without recomputing")
    void getCurrentSchedule_existing() {
        ScheduleSnapshot stored = ScheduleSnapshot.builder().id(ScheduleSnapshot.CURRENT_ID).referenceDate(TODAY).build();
        when(snapshotRepository.findById(ScheduleSnapshot.CURRENT_ID)).thenReturn(Optional.of(stored));

        assertSame(stored, scheduleService.getCurrentSchedule());
        verify(taskRepository, never()).findAllByOrderByCreatedAtAscIdAsc();
    }

    @Test
    @DisplayName("a snapshot anchored before today is recomputed from today on read")
    void getCurrentSchedule_staleSnapshot_recomputed() {
        Clock yesterdayClock = Clock.fixed(Instant.parse("2026-10-18T10:00:00Z"), ZoneOffset.UTC);
        ScheduleService yesterdayService = new ScheduleService(taskRepository, snapshotRepository,
                new SlotAllocator(SlotGrid.defaultGrid()), yesterdayClock);
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(task("a", 30, Priority.ASAP)));
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));
        ScheduleSnapshot yesterdays = yesterdayService.recompute();
        when(snapshotRepository.findById(ScheduleSnapshot.CURRENT_ID)).thenReturn(Optional.of(yesterdays));

        ScheduleSnapshot current = scheduleService.getCurrentSchedule();

        assertEquals(TODAY, current.getReferenceDate());
        assertEquals(List.of("2026-10-19"), List.copyOf(current.getDays().keySet()));
    }

    @Test
    @DisplayName("a snapshot replayed from a later date is served as is")
    void getCurrentSchedule_futureSnapshot_kept() {
        ScheduleSnapshot stored = ScheduleSnapshot.builder()
                .id(ScheduleSnapshot.CURRENT_ID)
                .referenceDate(TODAY.plusDays(3))
                .build();
        when(snapshotRepository.findById(ScheduleSnapshot.CURRENT_ID)).thenReturn(Optional.of(stored));

        assertSame(stored, scheduleService.getCurrentSchedule());
        verify(snapshotRepository, never()).save(any(ScheduleSnapshot.class));
    }

    @Test
    @DisplayName("fully tied tasks are placed in creation order")
    void recompute_tiesFollowCreationOrder() {
        Task a = task("a", 30, Priority.SOFT_DEADLINE);
        a.setCreatedAt(LocalDateTime.of(2026, 10, 1, 9, 0));
        Task b = task("b", 30, Priority.SOFT_DEADLINE);
        b.setCreatedAt(LocalDateTime.of(2026, 10, 2, 9, 0));
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(a, b));
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        ScheduleSnapshot snapshot = scheduleService.recompute();

        assertSame(a, snapshot.getDays().get("2026-10-19").get("9:00"));
        assertSame(b, snapshot.getDays().get("2026-10-19").get("9:30"));
        verify(taskRepository, never()).findAll();
    }

    @Test
    @DisplayName("a missing snapshot is computed and saved on first read")
    void getCurrentSchedule_missing() {
        when(snapshotRepository.findById(ScheduleSnapshot.CURRENT_ID)).thenReturn(Optional.empty());
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of(task("a", 30, Priority.ASAP)));
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        ScheduleSnapshot snapshot = scheduleService.getCurrentSchedule();

        assertEquals(1, snapshot.getTaskCount());
        verify(snapshotRepository).save(any(ScheduleSnapshot.class));
    }

    @Test
    @DisplayName("a task-set change is followed by a recompute")
    void applyTaskSetChange_recomputes() {
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of());
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenAnswer(inv -> inv.getArgument(0));

        String result = scheduleService.applyTaskSetChange(() -> "changed", changed -> { });

        assertEquals("changed", result);
        ArgumentCaptor<ScheduleSnapshot> captor = ArgumentCaptor.forClass(ScheduleSnapshot.class);
        verify(snapshotRepository).save(captor.capture());
        assertEquals(TODAY, captor.getValue().getReferenceDate());
    }

    @Test
    @DisplayName("a failed task-set change does not recompute")
    void applyTaskSetChange_failure_noRecompute() {
        assertThrows(TaskValidationException.class, () -> scheduleService.applyTaskSetChange(() -> {
            throw new TaskValidationException("bad task");
        }, changed -> { }));

        verify(snapshotRepository, never()).save(any(ScheduleSnapshot.class));
    }

    @Test
    @DisplayName("a change is reverted when its schedule cannot be saved")
    void applyTaskSetChange_saveFailure_reverts() {
        when(taskRepository.findAllByOrderByCreatedAtAscIdAsc()).thenReturn(List.of());
        when(snapshotRepository.save(any(ScheduleSnapshot.class))).thenThrow(new IllegalStateException("store down"));
        List<String> reverted = new ArrayList<>();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> scheduleService.applyTaskSetChange(() -> "changed", reverted::add));

        assertEquals("store down", e.getMessage());
        assertEquals(List.of("changed"), reverted);
    }

    @Test
    @DisplayName("slot labels come from the configured grid")
    void slotLabels_fromGrid() {
        List<String> labels = scheduleService.slotLabels();

        assertEquals(16, labels.size());
        assertEquals("9:00", labels.get(0));
    }
}
