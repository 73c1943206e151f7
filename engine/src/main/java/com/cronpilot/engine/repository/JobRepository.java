package com.cronpilot.engine.repository;

import com.cronpilot.engine.model.JobDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD + query operations for the jobs table.
 *
 * Paged listing lives in CronStore (offset/limit rather than page numbers).
 */
public interface JobRepository extends JpaRepository<JobDefinition, String> {

    /** Jobs the scheduler should keep a schedule for. */
    List<JobDefinition> findByEnabledTrueOrderByIdAsc();
}
