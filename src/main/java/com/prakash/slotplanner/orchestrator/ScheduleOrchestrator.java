package com.prakash.slotplanner.orchestrator;

import com.prakash.slotplanner.model.ScheduleSnapshot;
import com.prakash.slotplanner.service.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduleOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ScheduleOrchestrator.class);

    private final ScheduleService scheduleService;

    @Autowired
    public ScheduleOrchestrator(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    /**
     * Recomputes the persisted schedule shortly after midnight so it is anchored at the
     * new "today". Task-set changes recompute on their own; this only covers the date rollover.
     */
    @Scheduled(cron = "#{@schedulingProperties.refreshCron}", zone = "#{@schedulingProperties.zone}")
    public void refreshDailySchedule() {
        log.info("==== Orchestrator: Starting daily schedule refresh ====");
        try {
            ScheduleSnapshot snapshot = scheduleService.recompute();
            log.info("Orchestrator: Schedule refreshed for {} with {} tasks.", snapshot.getReferenceDate(), snapshot.getTaskCount());
        } catch (Exception e) {
            // Keep the previous snapshot; the next task change or run will retry
            log.error("Orchestrator: Error occurred during schedule refresh: {}", e.getMessage(), e);
        } finally {
            log.info("==== Orchestrator: Finished daily schedule refresh ====");
        }
    }
}
