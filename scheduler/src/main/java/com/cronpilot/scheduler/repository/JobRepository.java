package com.cronpilot.scheduler.repository;

import com.cronpilot.scheduler.model.Job;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + scheduler queries for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByName(String name);

    boolean existsByName(String name);

    long countByEnabledTrue();

    List<Job> findAllByOrderByNameAsc();

    /**
     * Enabled jobs whose next_run_at has passed, oldest first.
     * Served by the partial index idx_jobs_next_run.
     */
    @Query("""
            SELECT j FROM Job j
            WHERE j.enabled = true
              AND j.nextRunAt <= :now
            ORDER BY j.nextRunAt ASC, j.name ASC
            """)
    List<Job> findDue(@Param("now") Instant now);

    /**
     * Claim a due job: a conditional write on next_run_at.
     *
     * The WHERE clause re-checks "enabled and due" inside the UPDATE, so when
     * two scheduler instances race for the same occurrence the row lock taken
     * by the first UPDATE makes the second one re-evaluate against the new
     * next_run_at and match nothing.
     *
     * @return 1 if this caller claimed the job, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Job j
            SET j.lastRunAt = :dispatchTime,
                j.nextRunAt = :nextRunAt
            WHERE j.id = :id
              AND j.enabled = true
              AND j.nextRunAt <= :dispatchTime
            """)
    int claimDue(@Param("id") Long id,
                 @Param("dispatchTime") Instant dispatchTime,
                 @Param("nextRunAt") Instant nextRunAt);
}
