package com.prakash.slotplanner.repository;

import com.prakash.slotplanner.model.ScheduleSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduleSnapshotRepository extends MongoRepository<ScheduleSnapshot, String> {
}
