package com.prakash.slotplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Daily schedule refresh in ScheduleOrchestrator
public class SlotPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SlotPlannerApplication.class, args);
	}

}
