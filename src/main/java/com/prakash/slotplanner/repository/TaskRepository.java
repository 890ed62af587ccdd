package com.prakash.slotplanner.repository;

import com.prakash.slotplanner.model.Importance;
import com.prakash.slotplanner.model.Priority;
import com.prakash.slotplanner.model.Task;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TaskRepository extends MongoRepository<Task, String> {

    // Creation order; the ID breaks ties between tasks created in the same instant
    List<Task> findAllByOrderByCreatedAtAscIdAsc();

    List<Task> findByImportance(Importance importance);

    List<Task> findByPriority(Priority priority);

    List<Task> findByPriorityAndImportance(Priority priority, Importance importance);
}
