package com.cronpilot.scheduler.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution of a Job.
 *
 * Created in RUNNING the moment the scheduler dispatches the job, so a
 * crash mid-execution leaves a visible RUNNING row behind. Completed exactly
 * once by RunRecorder#completeRun, which holds a row lock while it checks
 * the current status.
 *
 * DB table: job_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_runs")
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Job job;

    // Read-only mirror of the FK so callers can get the id without touching the proxy.
    @Column(name = "job_id", insertable = false, updatable = false)
    private Long jobId;

    @Convert(converter = RunStatusConverter.class)
    @Column(nullable = false, length = 50)
    private RunStatus status = RunStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(columnDefinition = "TEXT")
    private String output;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobRun() {}   // required by JPA

    public JobRun(Job job, RunStatus status, Instant startedAt) {
        this.job       = job;
        this.jobId     = job.getId();
        this.status    = status;
        this.startedAt = startedAt;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Move this run into a terminal state.
     *
     * @throws IllegalStateException if the run is already terminal
     */
    public void complete(RunStatus outcome, String output, String errorMessage, Instant completedAt) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + id + " is already " + status.dbValue());
        }
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal outcome: " + outcome.dbValue());
        }
        long seconds = startedAt == null ? 0 : Duration.between(startedAt, completedAt).getSeconds();
        this.status          = outcome;
        this.output          = output;
        this.errorMessage    = errorMessage;
        this.completedAt     = completedAt;
        this.durationSeconds = (int) Math.max(0, seconds);
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public Long      getId()              { return id; }
    public Long      getJobId()           { return jobId; }
    public RunStatus getStatus()          { return status; }
    public Instant   getStartedAt()       { return startedAt; }
    public Instant   getCompletedAt()     { return completedAt; }
    public String    getOutput()          { return output; }
    public String    getErrorMessage()    { return errorMessage; }
    public Integer   getDurationSeconds() { return durationSeconds; }
}
