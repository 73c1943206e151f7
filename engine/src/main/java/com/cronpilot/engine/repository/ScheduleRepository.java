package com.cronpilot.engine.repository;

import com.cronpilot.engine.model.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ScheduleRepository extends JpaRepository<Schedule, String> {

    List<Schedule> findByNextDueLessThanEqualOrderByNextDueAsc(Instant now);
}
