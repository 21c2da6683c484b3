package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.model.JobRun;
import com.cronpilot.scheduler.model.RunStatus;
import com.cronpilot.scheduler.repository.JobRepository;
import com.cronpilot.scheduler.repository.JobRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Owns the job_runs table and every run status transition.
 *
 * Runs are independent of each other: completing one never locks another.
 */
@Service
public class RunRecorder {

    private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

    static final int HISTORY_PAGE_SIZE = 50;

    static final String INTERRUPTED_MESSAGE =
            "Interrupted: the scheduler stopped before this run completed";

    private final JobRunRepository runRepo;
    private final JobRepository    jobRepo;

    public RunRecorder(JobRunRepository runRepo, JobRepository jobRepo) {
        this.runRepo = runRepo;
        this.jobRepo = jobRepo;
    }

    /**
     * Persist a new RUNNING run for a job and return its id.
     *
     * Committed before the script starts, so a crash during execution leaves
     * a RUNNING row that failOrphanedRuns() can find later.
     */
    @Transactional
    public Long beginRun(Long jobId, Instant startTime) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobRun run = runRepo.save(new JobRun(job, RunStatus.RUNNING, startTime));
        log.info("Run {} started for job '{}' (id={})", run.getId(), job.getName(), jobId);
        return run.getId();
    }

    /**
     * Finish a run as SUCCESS or FAILED.
     *
     * The run row is locked for the check-and-set, so of two concurrent
     * completions exactly one applies and the other gets
     * InvalidRunTransitionException.
     *
     * @throws InvalidRunTransitionException if the run is already terminal (row unchanged)
     * @throws RunNotFoundException          if there is no such run
     * @throws IllegalArgumentException      if outcome is not SUCCESS or FAILED
     */
    @Transactional
    public JobRun completeRun(Long runId, RunStatus outcome, String output, String errorMessage, Instant endTime) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal outcome: " + outcome.dbValue());
        }
        JobRun run = runRepo.findByIdForUpdate(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (run.getStatus().isTerminal()) {
            throw new InvalidRunTransitionException(runId, run.getStatus(), outcome);
        }

        run.complete(outcome, output, errorMessage, endTime);
        JobRun saved = runRepo.save(run);
        if (outcome == RunStatus.SUCCESS) {
            log.info("Run {} (job id={}) succeeded in {}s", runId, run.getJobId(), run.getDurationSeconds());
        } else {
            log.warn("Run {} (job id={}) failed after {}s: {}",
                    runId, run.getJobId(), run.getDurationSeconds(), errorMessage);
        }
        return saved;
    }

    /**
     * History of a job, newest first, optionally restricted to one status.
     *
     * @throws JobNotFoundException if the job does not exist (a deleted job has no history)
     */
    @Transactional(readOnly = true)
    public RunHistory listRuns(Long jobId, int limit, RunStatus statusFilter) {
        if (!jobRepo.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        if (statusFilter == null) {
            return new RunHistory(page -> runRepo.findByJobIdOrderByStartedAtDescIdDesc(jobId, page),
                    limit, HISTORY_PAGE_SIZE);
        }
        return new RunHistory(page -> runRepo.findByJobIdAndStatusOrderByStartedAtDescIdDesc(jobId, statusFilter, page),
                limit, HISTORY_PAGE_SIZE);
    }

    /**
     * Fail every RUNNING run that started before {@code cutoff}.
     *
     * Called once at scheduler startup: any such run belonged to a scheduler
     * process that died without completing it.
     *
     * @return number of runs marked FAILED
     */
    @Transactional
    public int failOrphanedRuns(Instant cutoff, Instant now) {
        List<JobRun> orphans = runRepo.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff);
        int failed = 0;
        for (JobRun orphan : orphans) {
            try {
                completeRun(orphan.getId(), RunStatus.FAILED, orphan.getOutput(), INTERRUPTED_MESSAGE, now);
                failed++;
                log.warn("Marked orphaned run {} (job id={}, started {}) as failed",
                        orphan.getId(), orphan.getJobId(), orphan.getStartedAt());
            } catch (InvalidRunTransitionException e) {
                log.info("Orphan candidate {} was completed concurrently: {}", orphan.getId(), e.getMessage());
            }
        }
        return failed;
    }

    @Transactional(readOnly = true)
    public long countRunning() {
        return runRepo.countByStatus(RunStatus.RUNNING);
    }
}
