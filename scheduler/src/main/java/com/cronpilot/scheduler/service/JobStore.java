package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.repository.JobRepository;
import com.cronpilot.scheduler.schedule.InvalidScheduleException;
import com.cronpilot.scheduler.schedule.ScheduleCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job definitions and their schedule bookkeeping.
 *
 * next_run_at is owned here: it is recomputed from the cron expression
 * whenever a job is created, edited, enabled or dispatched, and cleared
 * while the job is disabled.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    // Column sizes from V1__create_scheduler_schema.sql
    private static final int MAX_NAME_LENGTH   = 255;
    private static final int MAX_SCRIPT_LENGTH = 255;
    private static final int MAX_CRON_LENGTH   = 100;

    private final JobRepository      jobRepo;
    private final ScheduleCalculator schedule;
    private final Clock              clock;

    public JobStore(JobRepository jobRepo, ScheduleCalculator schedule, Clock clock) {
        this.jobRepo  = jobRepo;
        this.schedule = schedule;
        this.clock    = clock;
    }

    // ------------------------------------------------------------------
    // Due-job scan + claim (called by JobScheduler)
    // ------------------------------------------------------------------

    /**
     * Enabled jobs whose next_run_at is at or before {@code now}, ordered by
     * next_run_at then name.
     */
    @Transactional(readOnly = true)
    public List<Job> listDueJobs(Instant now) {
        Map<Long, Job> due = new LinkedHashMap<>();
        for (Job job : jobRepo.findDue(now)) {
            if (job.isEnabled() && job.getNextRunAt() != null && !job.getNextRunAt().isAfter(now)) {
                due.putIfAbsent(job.getId(), job);
            }
        }
        return List.copyOf(due.values());
    }

    /**
     * Claim one due occurrence of a job.
     *
     * Sets last_run_at = dispatchTime and next_run_at = the next occurrence
     * after dispatchTime, in a single conditional UPDATE guarded by
     * "enabled and next_run_at <= dispatchTime". Overdue jobs are therefore
     * dispatched once and rescheduled from now; missed occurrences are not
     * backfilled.
     *
     * @return the claim, or empty if another caller already claimed this occurrence
     * @throws JobNotFoundException if the job no longer exists
     * @throws JobDisabledException if the job was disabled concurrently
     */
    @Transactional
    public Optional<DispatchClaim> recordDispatch(Long jobId, Instant dispatchTime) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (!job.isEnabled()) {
            throw new JobDisabledException(jobId);
        }

        Instant next = schedule.nextOccurrence(job.getCronExpression(), dispatchTime);
        warnIfOccurrencesMissed(job, dispatchTime);

        int updated = jobRepo.claimDue(jobId, dispatchTime, next);
        if (updated == 0) {
            // Lost the race, or the job changed under us. Find out which.
            Job current = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (!current.isEnabled()) {
                throw new JobDisabledException(jobId);
            }
            log.info("Job '{}' (id={}) is no longer due at {} (next_run_at={}); already claimed",
                    current.getName(), jobId, dispatchTime, current.getNextRunAt());
            return Optional.empty();
        }

        log.info("Claimed job '{}' (id={}) at {}; next run at {}", job.getName(), jobId, dispatchTime, next);
        return Optional.of(new DispatchClaim(jobId, dispatchTime, next));
    }

    // ------------------------------------------------------------------
    // Definitions
    // ------------------------------------------------------------------

    /**
     * Create (definition.id == null) or update a job.
     *
     * @throws JobValidationException on a blank name/script, bad cron or over-long value
     * @throws JobConflictException   if the name is taken by another job
     * @throws JobNotFoundException   if updating a job that does not exist
     */
    @Transactional
    public Job upsertJob(JobDefinition def) {
        return def.id() == null ? create(def) : update(def);
    }

    private Job create(JobDefinition def) {
        String name = trimToNull(def.name());
        validate(name, def.scriptPath(), def.cronExpression());
        if (jobRepo.existsByName(name)) {
            throw new JobConflictException(name);
        }

        Job job = new Job(name, def.scriptPath().trim(), def.cronExpression().trim(), clock.instant());
        job.setDescription(def.description() == null ? "" : def.description());
        job.setEnabled(def.enabled() == null || def.enabled());
        job.setConfig(def.config());
        reschedule(job);

        try {
            Job saved = jobRepo.saveAndFlush(job);
            log.info("Created job '{}' (id={}, cron='{}', next run {})",
                    saved.getName(), saved.getId(), saved.getCronExpression(), saved.getNextRunAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Unique constraint on name: a concurrent create won.
            throw new JobConflictException(name, e);
        }
    }

    private Job update(JobDefinition def) {
        Job job = jobRepo.findById(def.id()).orElseThrow(() -> new JobNotFoundException(def.id()));

        String name   = def.name()           != null ? trimToNull(def.name())    : job.getName();
        String script = def.scriptPath()     != null ? def.scriptPath()          : job.getScriptPath();
        String cron   = def.cronExpression() != null ? def.cronExpression()      : job.getCronExpression();
        validate(name, script, cron);

        if (!name.equals(job.getName())) {
            jobRepo.findByName(name)
                    .filter(other -> !other.getId().equals(job.getId()))
                    .ifPresent(other -> { throw new JobConflictException(name); });
        }

        job.setName(name);
        job.setScriptPath(script.trim());
        job.setCronExpression(cron.trim());
        if (def.description() != null) job.setDescription(def.description());
        if (def.enabled() != null)     job.setEnabled(def.enabled());
        if (def.config() != null)      job.setConfig(def.config());
        reschedule(job);
        touch(job);

        try {
            Job saved = jobRepo.saveAndFlush(job);
            log.info("Updated job '{}' (id={}, enabled={}, next run {})",
                    saved.getName(), saved.getId(), saved.isEnabled(), saved.getNextRunAt());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new JobConflictException(name, e);
        }
    }

    /**
     * Enable or disable a job. Disabling clears next_run_at and only affects
     * future polls; a run already in flight keeps going.
     */
    @Transactional
    public Job setEnabled(Long jobId, boolean enabled) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        job.setEnabled(enabled);
        reschedule(job);
        touch(job);
        log.info("Job '{}' (id={}) {}; next run {}",
                job.getName(), jobId, enabled ? "enabled" : "disabled", job.getNextRunAt());
        return jobRepo.save(job);
    }

    /** Delete a job and, by cascade, its whole run history. */
    @Transactional
    public void deleteJob(Long jobId) {
        Job job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        jobRepo.delete(job);
        log.info("Deleted job '{}' (id={}) and its run history", job.getName(), jobId);
    }

    /**
     * Recompute next_run_at of every job from its schedule.
     *
     * Idempotent for rows the scheduler maintains itself; repairs rows
     * inserted or edited behind its back (e.g. by hand in SQL).
     *
     * @return number of jobs whose next_run_at changed
     */
    @Transactional
    public int refreshSchedules() {
        int changed = 0;
        for (Job job : jobRepo.findAll()) {
            Instant before = job.getNextRunAt();
            try {
                reschedule(job);
            } catch (JobValidationException e) {
                log.warn("Job '{}' (id={}) has an unusable schedule and will not run: {}",
                        job.getName(), job.getId(), e.getMessage());
                job.setNextRunAt(null);
            }
            if (before == null ? job.getNextRunAt() != null : !before.equals(job.getNextRunAt())) {
                touch(job);
                jobRepo.save(job);
                changed++;
                log.info("Rescheduled job '{}' (id={}): {} -> {}",
                        job.getName(), job.getId(), before, job.getNextRunAt());
            }
        }
        return changed;
    }

    @Transactional(readOnly = true)
    public Job getJob(Long jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public Optional<Job> findByName(String name) {
        return jobRepo.findByName(name);
    }

    @Transactional(readOnly = true)
    public List<Job> listJobs() {
        return jobRepo.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public long countJobs() {
        return jobRepo.count();
    }

    @Transactional(readOnly = true)
    public long countEnabledJobs() {
        return jobRepo.countByEnabledTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** next_run_at = next occurrence after the last run (or creation); null while disabled. */
    private void reschedule(Job job) {
        if (!job.isEnabled()) {
            job.setNextRunAt(null);
            return;
        }
        try {
            job.setNextRunAt(schedule.nextOccurrence(job.getCronExpression(), job.scheduleAnchor()));
        } catch (InvalidScheduleException e) {
            throw new JobValidationException(e.getMessage(), e);
        }
    }

    // The trigger sets the stored value; this keeps the entity dirty so an UPDATE is always issued.
    private void touch(Job job) {
        job.setUpdatedAt(clock.instant());
    }

    private void validate(String name, String scriptPath, String cronExpression) {
        if (name == null) {
            throw new JobValidationException("Missing required field: name");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new JobValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (scriptPath == null || scriptPath.isBlank()) {
            throw new JobValidationException("Missing required field: scriptPath");
        }
        if (scriptPath.trim().length() > MAX_SCRIPT_LENGTH) {
            throw new JobValidationException("scriptPath must be at most " + MAX_SCRIPT_LENGTH + " characters");
        }
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new JobValidationException("Missing required field: cronExpression");
        }
        if (cronExpression.trim().length() > MAX_CRON_LENGTH) {
            throw new JobValidationException("cronExpression must be at most " + MAX_CRON_LENGTH + " characters");
        }
        try {
            schedule.validate(cronExpression);
        } catch (InvalidScheduleException e) {
            throw new JobValidationException(e.getMessage(), e);
        }
    }

    private void warnIfOccurrencesMissed(Job job, Instant dispatchTime) {
        Instant due = job.getNextRunAt();
        if (due == null) return;
        Instant following = schedule.nextOccurrence(job.getCronExpression(), due);
        if (!following.isAfter(dispatchTime)) {
            log.warn("Job '{}' (id={}) missed occurrences since {}; running once now, not backfilling",
                    job.getName(), job.getId(), due);
        }
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
