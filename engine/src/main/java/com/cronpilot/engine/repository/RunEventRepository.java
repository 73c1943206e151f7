package com.cronpilot.engine.repository;

import com.cronpilot.engine.model.RunEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Append-only access to run_events. No update methods on purpose: events
 * are removed only when their job is deleted.
 */
public interface RunEventRepository extends JpaRepository<RunEvent, String> {

    List<RunEvent> findByRunIdOrderByOccurredAtAscSeqAsc(String runId);

    /** Newest first; callers reverse the page to get replay order. */
    List<RunEvent> findByRunIdOrderByOccurredAtDescSeqDesc(String runId, Pageable page);

    Optional<RunEvent> findFirstByRunIdOrderByOccurredAtDescSeqDesc(String runId);

    long countByRunIdAndEvent(String runId, String event);

    @Modifying
    @Query("DELETE FROM RunEvent e WHERE e.runId IN (SELECT r.id FROM JobRun r WHERE r.jobId = :jobId)")
    int deleteByJobId(@Param("jobId") String jobId);
}
