package com.prakash.slotplanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scheduling options loaded from application properties.
 * <p>
 * Bound to the property prefix <strong>slotplanner.scheduling</strong>.
 * </p>
 *
 * Example configuration in <code>application.properties</code>:
 * <pre>
 * slotplanner.scheduling.start-hour=8
 * slotplanner.scheduling.end-hour=18
 * slotplanner.scheduling.zone=Europe/Berlin
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "slotplanner.scheduling")
public class SchedulingProperties {

    /**
     * First hour of the working-day grid (inclusive).
     */
    private int startHour = 9;

    /**
     * Hour the working-day grid stops at (exclusive).
     */
    private int endHour = 17;

    /**
     * How many times one task may roll over to the next day before it is reported as unschedulable.
     */
    private int maxLookAheadDays = 365;

    /**
     * Zone that decides which calendar date counts as "today".
     */
    private String zone = "UTC";

    /**
     * Cron expression for the daily recompute that re-anchors the schedule at the new date.
     */
    private String refreshCron = "0 5 0 * * *";

    public int getStartHour() {
        return startHour;
    }

    public void setStartHour(int startHour) {
        this.startHour = startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public void setEndHour(int endHour) {
        this.endHour = endHour;
    }

    public int getMaxLookAheadDays() {
        return maxLookAheadDays;
    }

    public void setMaxLookAheadDays(int maxLookAheadDays) {
        this.maxLookAheadDays = maxLookAheadDays;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getRefreshCron() {
        return refreshCron;
    }

    public void setRefreshCron(String refreshCron) {
        this.refreshCron = refreshCron;
    }
}
