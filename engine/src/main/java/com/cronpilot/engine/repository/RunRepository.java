package com.cronpilot.engine.repository;

import com.cronpilot.engine.model.JobRun;
import com.cronpilot.engine.model.RunState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + state queries for the runs table.
 */
public interface RunRepository extends JpaRepository<JobRun, String> {

    /**
     * Load a run with a row lock (SELECT ... FOR UPDATE).
     *
     * Every state transition goes through this query so two workers can
     * never both move the same run out of a given state. Must be called
     * inside a transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM JobRun r WHERE r.id = :id")
    Optional<JobRun> findForUpdate(@Param("id") String id);

    List<JobRun> findByJobIdAndStateIn(String jobId, Collection<RunState> states);

    List<JobRun> findByStateIn(Collection<RunState> states);

    /** DUE runs of one job in arrival order; the head of the list is the next one the queue policy admits. */
    List<JobRun> findByJobIdAndStateOrderByScheduledAtAscCreatedAtAsc(String jobId, RunState state);

    List<JobRun> findByStateAndScheduledAtLessThanEqualOrderByScheduledAtAsc(RunState state, Instant cutoff);

    long countByJobIdAndState(String jobId, RunState state);

    Optional<JobRun> findFirstByJobIdAndStateAndDryRunFalseAndIdNotOrderByCompletedAtDesc(String jobId, RunState state, String excludedId);

    long countByJobId(String jobId);

    @Modifying
    @Query("DELETE FROM JobRun r WHERE r.jobId = :jobId")
    int deleteByJobIdInBulk(@Param("jobId") String jobId);
}
