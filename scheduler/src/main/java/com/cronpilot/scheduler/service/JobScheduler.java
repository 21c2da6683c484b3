package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.config.SchedulerProperties;
import com.cronpilot.scheduler.executor.ScriptExecutionException;
import com.cronpilot.scheduler.executor.ScriptExecutor;
import com.cronpilot.scheduler.executor.dto.ScriptInvocation;
import com.cronpilot.scheduler.executor.dto.ScriptResult;
import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.model.RunStatus;
import com.cronpilot.scheduler.model.SchedulerState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The polling loop.
 *
 * Every poll interval it asks the JobStore for due jobs, claims each one,
 * records a RUNNING run and hands the script to a worker thread. The loop
 * itself never waits for a script: execution, completion and timeouts all
 * happen off the polling thread.
 *
 * Several instances may poll the same database. They coordinate only
 * through JobStore#recordDispatch, whose conditional UPDATE lets exactly one
 * of them claim a given occurrence.
 */
@Component
@EnableScheduling
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    /** Per-job override of the run timeout, read from the job's config document. */
    static final String TIMEOUT_CONFIG_KEY = "timeout_seconds";

    private final JobStore            jobStore;
    private final RunRecorder         runRecorder;
    private final ScriptExecutor      scriptExecutor;
    private final Clock               clock;
    private final SchedulerProperties props;
    private final MeterRegistry       meterRegistry;

    private final ExecutorService          workers;
    private final ScheduledExecutorService watchdog;

    private final AtomicReference<SchedulerState> state     = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicBoolean                   recovered = new AtomicBoolean(false);
    private final Map<Long, Future<?>>            inFlight  = new ConcurrentHashMap<>();

    public JobScheduler(JobStore jobStore,
                        RunRecorder runRecorder,
                        ScriptExecutor scriptExecutor,
                        Clock clock,
                        SchedulerProperties props,
                        MeterRegistry meterRegistry) {
        this.jobStore       = jobStore;
        this.runRecorder    = runRecorder;
        this.scriptExecutor = scriptExecutor;
        this.clock          = clock;
        this.props          = props;
        this.meterRegistry  = meterRegistry;
        this.workers        = Executors.newFixedThreadPool(props.workerCount());
        this.watchdog       = Executors.newSingleThreadScheduledExecutor();
    }

    // ------------------------------------------------------------------
    // Polling
    // ------------------------------------------------------------------

    /**
     * One polling cycle.
     *
     * The first cycle of each process first fails runs orphaned by a previous
     * crash and repairs next_run_at values, so nothing is dispatched before
     * that cleanup has committed.
     *
     * Store failures are retried with backoff; if the store stays down for
     * the whole retry budget the loop halts and later ticks do nothing.
     */
    @Scheduled(fixedDelayString = "${cronpilot.scheduler.poll-interval-ms:10000}")
    public void tick() {
        if (state.get() == SchedulerState.HALTED) {
            return;
        }
        try {
            withStoreRetry(() -> {
                if (!recovered.get()) {
                    recoverAfterRestart();
                    recovered.set(true);
                }
                runCycle();
            });
        } catch (StoreUnavailableException e) {
            state.set(SchedulerState.HALTED);
            meterRegistry.counter("cronpilot.scheduler.halts").increment();
            log.error("Job store unavailable after {} attempts; scheduler loop halted",
                    props.storeRetry().maxAttempts(), e);
        }
    }

    /**
     * IDLE → POLLING → DISPATCHING → IDLE.
     *
     * @return number of jobs dispatched in this cycle
     */
    int runCycle() {
        Instant now = clock.instant();
        state.set(SchedulerState.POLLING);
        try {
            List<Job> due = jobStore.listDueJobs(now);
            if (!due.isEmpty()) {
                log.info("{} job(s) due at {}", due.size(), now);
            }

            state.set(SchedulerState.DISPATCHING);
            int dispatched = 0;
            for (Job job : due) {
                if (dispatch(job, now)) dispatched++;
            }
            return dispatched;
        } finally {
            state.compareAndSet(SchedulerState.POLLING, SchedulerState.IDLE);
            state.compareAndSet(SchedulerState.DISPATCHING, SchedulerState.IDLE);
        }
    }

    /** Fail orphaned runs, then make sure every job's next_run_at matches its schedule. */
    void recoverAfterRestart() {
        Instant now    = clock.instant();
        Instant cutoff = now.minus(props.staleRunThreshold());
        int orphans = runRecorder.failOrphanedRuns(cutoff, now);
        if (orphans > 0) {
            log.warn("Failed {} run(s) left RUNNING since before {}", orphans, cutoff);
        }
        int rescheduled = jobStore.refreshSchedules();
        log.info("Scheduler recovery complete: {} orphaned run(s) failed, {} job(s) rescheduled",
                orphans, rescheduled);
    }

    /**
     * Claim one due job and start it.
     *
     * A job that vanished, was disabled, or was claimed by another instance
     * is skipped for this cycle. Anything else that goes wrong with one job
     * is logged and does not stop the cycle, except store failures, which
     * propagate to the retry policy.
     */
    private boolean dispatch(Job job, Instant now) {
        try {
            if (jobStore.recordDispatch(job.getId(), now).isEmpty()) {
                return false;
            }
            Long runId = runRecorder.beginRun(job.getId(), now);
            submit(job, runId);
            meterRegistry.counter("cronpilot.job.dispatches", "job", job.getName(), "trigger", "schedule").increment();
            return true;
        } catch (JobNotFoundException e) {
            log.warn("Job '{}' (id={}) was deleted before it could be dispatched; skipping",
                    job.getName(), job.getId());
        } catch (JobDisabledException e) {
            log.warn("Job '{}' (id={}) was disabled before it could be dispatched; skipping",
                    job.getName(), job.getId());
        } catch (DataAccessException | TransactionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Could not dispatch job '{}' (id={}): {}", job.getName(), job.getId(), e.getMessage(), e);
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Manual trigger
    // ------------------------------------------------------------------

    /**
     * Run a job now, outside its schedule. next_run_at is left alone.
     *
     * @return the id of the new run
     * @throws JobNotFoundException if the job does not exist
     */
    public Long triggerNow(Long jobId) {
        Job job = jobStore.getJob(jobId);
        Long runId = runRecorder.beginRun(jobId, clock.instant());
        log.info("Manual run {} requested for job '{}' (id={})", runId, job.getName(), jobId);
        submit(job, runId);
        meterRegistry.counter("cronpilot.job.dispatches", "job", job.getName(), "trigger", "manual").increment();
        return runId;
    }

    // ------------------------------------------------------------------
    // Execution (worker threads)
    // ------------------------------------------------------------------

    private void submit(Job job, Long runId) {
        ScriptInvocation invocation = new ScriptInvocation(
                job.getId(), job.getName(), runId, job.getScriptPath(), job.getConfig());
        RunTask task = new RunTask(invocation, timeoutFor(job));
        inFlight.put(runId, task);
        workers.execute(task);
    }

    /**
     * One run on the worker pool.
     *
     * The timeout clock starts when a worker picks the run up, not while it
     * waits in the queue. done() fires on every exit path (normal end,
     * exception, or cancellation, even before the run started), so it is
     * where the run leaves the in-flight map.
     */
    private final class RunTask extends FutureTask<Void> {

        private final ScriptInvocation invocation;
        private final Duration         timeout;
        private volatile ScheduledFuture<?> timer;

        RunTask(ScriptInvocation invocation, Duration timeout) {
            super(() -> execute(invocation), null);
            this.invocation = invocation;
            this.timeout    = timeout;
        }

        @Override
        public void run() {
            if (isDone()) return;
            timer = watchdog.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
            super.run();
        }

        @Override
        protected void done() {
            inFlight.remove(invocation.runId());
            ScheduledFuture<?> t = timer;
            if (t != null) t.cancel(false);
        }

        /**
         * Watchdog: fail a run that is still going after its timeout, then
         * cancel the worker. Cancelling interrupts the worker thread, which
         * kills the subprocess; termination is best-effort.
         */
        private void expire() {
            if (isDone()) {
                return;
            }
            log.warn("Run {} of job '{}' exceeded its {} timeout; cancelling",
                    invocation.runId(), invocation.jobName(), timeout);
            if (finish(invocation, RunStatus.FAILED, null, "Timed out after " + timeout)) {
                meterRegistry.counter("cronpilot.run.timeouts", "job", invocation.jobName()).increment();
            }
            cancel(true);
        }
    }

    private void execute(ScriptInvocation invocation) {
        // MDC so every log line from this worker carries the job and run.
        MDC.put("jobId",   String.valueOf(invocation.jobId()));
        MDC.put("jobName", invocation.jobName());
        MDC.put("runId",   String.valueOf(invocation.runId()));
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            ScriptResult result = scriptExecutor.execute(invocation);
            if (result.success()) {
                finish(invocation, RunStatus.SUCCESS, result.stdout(), null);
            } else {
                outcome = "failed";
                finish(invocation, RunStatus.FAILED, result.stdout(), result.errorText());
            }
        } catch (ScriptExecutionException e) {
            outcome = "error";
            finish(invocation, RunStatus.FAILED, null, e.getMessage());
        } catch (Exception e) {
            outcome = "error";
            log.error("Unhandled error running job '{}': {}", invocation.jobName(), e.getMessage(), e);
            finish(invocation, RunStatus.FAILED, null, "Unhandled exception: " + e.getMessage());
        } finally {
            sample.stop(meterRegistry.timer("cronpilot.run.duration",
                    "job", invocation.jobName(), "outcome", outcome));
            MDC.clear();
        }
    }

    /**
     * Record the outcome of a run. Losing a completion race is expected
     * (worker vs. watchdog) and only logged.
     *
     * @return true if this call moved the run into its terminal state
     */
    private boolean finish(ScriptInvocation invocation, RunStatus outcome, String output, String errorMessage) {
        try {
            runRecorder.completeRun(invocation.runId(), outcome, output, errorMessage, clock.instant());
            return true;
        } catch (InvalidRunTransitionException e) {
            log.warn("Ignoring late completion of run {}: {}", invocation.runId(), e.getMessage());
        } catch (RuntimeException e) {
            // The run stays RUNNING; startup recovery will fail it later.
            log.error("Could not record outcome {} for run {}: {}",
                    outcome.dbValue(), invocation.runId(), e.getMessage(), e);
        }
        return false;
    }

    Duration timeoutFor(Job job) {
        Object override = job.getConfig() == null ? null : job.getConfig().get(TIMEOUT_CONFIG_KEY);
        if (override != null) {
            try {
                long seconds = override instanceof Number n ? n.longValue() : Long.parseLong(override.toString().trim());
                if (seconds > 0) return Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                log.warn("Job '{}' has a non-numeric {} '{}'; using the default timeout",
                        job.getName(), TIMEOUT_CONFIG_KEY, override);
            }
        }
        return props.jobTimeout();
    }

    // ------------------------------------------------------------------
    // Store retry
    // ------------------------------------------------------------------

    private void withStoreRetry(Runnable action) {
        SchedulerProperties.StoreRetry retry = props.storeRetry();
        Duration backoff = retry.initialBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                action.run();
                return;
            } catch (DataAccessException | TransactionException e) {
                state.set(SchedulerState.IDLE);
                if (attempt >= retry.maxAttempts()) {
                    throw new StoreUnavailableException("Job store unreachable: " + e.getMessage(), e);
                }
                log.warn("Job store error (attempt {}/{}), retrying in {}: {}",
                        attempt, retry.maxAttempts(), backoff, e.getMessage());
                sleep(backoff);
                long nextMillis = (long) (backoff.toMillis() * retry.multiplier());
                backoff = Duration.ofMillis(Math.min(nextMillis, retry.maxBackoff().toMillis()));
            }
        }
    }

    private static void sleep(Duration d) {
        if (d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting to retry the job store", e);
        }
    }

    // ------------------------------------------------------------------
    // Status / lifecycle
    // ------------------------------------------------------------------

    public SchedulerStatus status() {
        return new SchedulerStatus(state.get(), recovered.get(), inFlight.size());
    }

    @PreDestroy
    void shutdown() {
        log.info("Shutting down scheduler ({} run(s) in flight)", inFlight.size());
        // Workers first, so no run can start and arm a timer on a stopped watchdog.
        workers.shutdownNow();
        watchdog.shutdownNow();
    }
}
