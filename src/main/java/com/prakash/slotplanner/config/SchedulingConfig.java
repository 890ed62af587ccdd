package com.prakash.slotplanner.config;

import com.prakash.slotplanner.exception.SchedulingConfigurationException;
import com.prakash.slotplanner.service.scheduler.SlotAllocator;
import com.prakash.slotplanner.service.scheduler.SlotGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Wires the slot grid, the allocator and the clock "today" is read from.
 * Bad grid bounds or an unknown zone stop the application from starting.
 */
@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public SlotGrid slotGrid(SchedulingProperties properties) {
        SlotGrid grid = SlotGrid.of(properties.getStartHour(), properties.getEndHour());
        log.info("Using slot grid {}", grid);
        return grid;
    }

    @Bean
    public SlotAllocator slotAllocator(SlotGrid slotGrid, SchedulingProperties properties) {
        return new SlotAllocator(slotGrid, properties.getMaxLookAheadDays());
    }

    @Bean
    public Clock schedulingClock(SchedulingProperties properties) {
        try {
            return Clock.system(ZoneId.of(properties.getZone()));
        } catch (DateTimeException e) {
            throw new SchedulingConfigurationException("Unknown scheduling zone: " + properties.getZone());
        }
    }
}
