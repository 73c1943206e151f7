package com.cronpilot.engine.repository;

import com.cronpilot.engine.model.ResourceLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

/**
 * Access to the locks table. Acquisition is an INSERT that relies on the
 * UNIQUE(resource) constraint; see CronStore#acquireLock.
 */
public interface LockRepository extends JpaRepository<ResourceLock, String> {

    Optional<ResourceLock> findByResource(String resource);

    @Modifying
    @Query("DELETE FROM ResourceLock l WHERE l.resource = :resource AND l.expiresAt IS NOT NULL AND l.expiresAt <= :now")
    int deleteExpired(@Param("resource") String resource, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ResourceLock l WHERE l.expiresAt IS NOT NULL AND l.expiresAt <= :now")
    int deleteAllExpired(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ResourceLock l WHERE l.resource = :resource AND l.owner = :owner")
    int deleteByResourceAndOwner(@Param("resource") String resource, @Param("owner") String owner);

    /** Every lock tied to a job: its concurrency lock, schedule lock, and any lock held by or claiming one of its runs. */
    @Modifying
    @Query("""
            DELETE FROM ResourceLock l
            WHERE l.resource = :jobId
               OR l.resource = :scheduleResource
               OR l.owner IN (SELECT r.id FROM JobRun r WHERE r.jobId = :jobId)
               OR l.resource IN (SELECT CONCAT('run:', r.id) FROM JobRun r WHERE r.jobId = :jobId)
            """)
    int deleteByJob(@Param("jobId") String jobId, @Param("scheduleResource") String scheduleResource);
}
