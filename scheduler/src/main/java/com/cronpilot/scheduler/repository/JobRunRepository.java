package com.cronpilot.scheduler.repository;

import com.cronpilot.scheduler.model.JobRun;
import com.cronpilot.scheduler.model.RunStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + history queries for the job_runs table.
 */
public interface JobRunRepository extends JpaRepository<JobRun, Long> {

    /**
     * Load a run with SELECT ... FOR UPDATE.
     *
     * Must run inside a @Transactional method: the lock is what makes
     * "check status, then complete" atomic when the worker and the timeout
     * watchdog both try to finish the same run.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM JobRun r WHERE r.id = :id")
    Optional<JobRun> findByIdForUpdate(@Param("id") Long id);

    /** One page of a job's history, newest first. */
    Slice<JobRun> findByJobIdOrderByStartedAtDescIdDesc(Long jobId, Pageable pageable);

    /** One page of a job's history restricted to one status, newest first. */
    Slice<JobRun> findByJobIdAndStatusOrderByStartedAtDescIdDesc(Long jobId, RunStatus status, Pageable pageable);

    /**
     * Runs stuck in a status since before 'cutoff'.
     * Used at startup to find runs orphaned by a crashed scheduler.
     */
    List<JobRun> findByStatusAndStartedAtBefore(RunStatus status, Instant cutoff);

    long countByStatus(RunStatus status);
}
