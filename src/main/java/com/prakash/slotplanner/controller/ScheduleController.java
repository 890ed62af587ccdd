package com.prakash.slotplanner.controller;

import com.prakash.slotplanner.dto.ScheduleResponse;
import com.prakash.slotplanner.exception.UnschedulableTaskException;
import com.prakash.slotplanner.model.ScheduleSnapshot;
import com.prakash.slotplanner.service.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/schedule")
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;

    @Autowired
    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    /**
     * Endpoint to read the current schedule.
     *
     * @param date optional ISO date; when given only that day is returned
     */
    @GetMapping
    public ResponseEntity<ScheduleResponse> getSchedule(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.debug("Received request to get schedule. Date filter: {}", date);
        ScheduleSnapshot snapshot = scheduleService.getCurrentSchedule();
        if (date == null) {
            return ResponseEntity.ok(ScheduleResponse.fromSnapshot(snapshot));
        }
        String key = date.toString();
        return ResponseEntity.ok(ScheduleResponse.fromSnapshot(snapshot, key::equals));
    }

    /**
     * Endpoint to force a recompute, optionally replaying it from another reference date.
     */
    @PostMapping("/recompute")
    public ResponseEntity<ScheduleResponse> recompute(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDate) {
        log.info("Received request to recompute schedule. Reference date: {}", referenceDate != null ? referenceDate : "today");
        try {
            ScheduleSnapshot snapshot = referenceDate != null
                    ? scheduleService.recompute(referenceDate)
                    : scheduleService.recompute();
            return ResponseEntity.ok(ScheduleResponse.fromSnapshot(snapshot));
        } catch (UnschedulableTaskException e) {
            log.warn("Cannot recompute schedule: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error recomputing schedule: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(null);
        }
    }

    @GetMapping("/slots")
    public ResponseEntity<List<String>> getSlots() {
        return ResponseEntity.ok(scheduleService.slotLabels());
    }
}
