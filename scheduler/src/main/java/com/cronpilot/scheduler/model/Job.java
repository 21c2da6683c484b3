package com.cronpilot.scheduler.model;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A recurring job: an external script run on a cron schedule.
 *
 * The scheduler selects a job when it is enabled and next_run_at has passed,
 * then claims it by moving next_run_at forward (see JobRepository#claimDue).
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "script_path", nullable = false, length = 255)
    private String scriptPath;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    // Overwritten by the update_jobs_updated_at trigger on every UPDATE.
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    // Null while the job is disabled.
    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> config = new HashMap<>();

    // Runs are removed with their job (ON DELETE CASCADE in the schema as well).
    @OneToMany(mappedBy = "job", cascade = CascadeType.REMOVE, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<JobRun> runs = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(String name, String scriptPath, String cronExpression, Instant createdAt) {
        this.name           = name;
        this.scriptPath     = scriptPath;
        this.cronExpression = cronExpression;
        this.createdAt      = createdAt;
        this.updatedAt      = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public Long    getId()             { return id; }
    public String  getName()           { return name; }
    public String  getDescription()    { return description; }
    public String  getScriptPath()     { return scriptPath; }
    public String  getCronExpression() { return cronExpression; }
    public boolean isEnabled()         { return enabled; }
    public Instant getCreatedAt()      { return createdAt; }
    public Instant getUpdatedAt()      { return updatedAt; }
    public Instant getLastRunAt()      { return lastRunAt; }
    public Instant getNextRunAt()      { return nextRunAt; }
    public Map<String, Object> getConfig() { return config; }

    public void setName(String name)                     { this.name = name; }
    public void setDescription(String description)       { this.description = description; }
    public void setScriptPath(String scriptPath)         { this.scriptPath = scriptPath; }
    public void setCronExpression(String cronExpression) { this.cronExpression = cronExpression; }
    public void setEnabled(boolean enabled)              { this.enabled = enabled; }
    public void setUpdatedAt(Instant t)                  { this.updatedAt = t; }
    public void setLastRunAt(Instant t)                  { this.lastRunAt = t; }
    public void setNextRunAt(Instant t)                  { this.nextRunAt = t; }

    public void setConfig(Map<String, Object> config) {
        this.config = config == null ? new HashMap<>() : new HashMap<>(config);
    }

    /** The instant the schedule is measured from: the last run, or creation if it never ran. */
    public Instant scheduleAnchor() {
        return lastRunAt != null ? lastRunAt : createdAt;
    }
}
