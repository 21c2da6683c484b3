package com.cronpilot.scheduler.config;

import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.service.JobConflictException;
import com.cronpilot.scheduler.service.JobDefinition;
import com.cronpilot.scheduler.service.JobStore;
import com.cronpilot.scheduler.service.JobValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Upserts the jobs declared under cronpilot.jobs at startup.
 *
 * Matching is by name: a declared job that already exists is updated in
 * place (keeping its id and run history), otherwise it is created. A bad
 * declaration is logged and skipped; it does not stop the application.
 */
@Component
public class JobDefinitionLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JobDefinitionLoader.class);

    private final JobDefinitionsProperties declared;
    private final JobStore                 jobStore;

    public JobDefinitionLoader(JobDefinitionsProperties declared, JobStore jobStore) {
        this.declared = declared;
        this.jobStore = jobStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (declared.jobs().isEmpty()) {
            return;
        }
        int loaded = 0;
        for (JobDefinitionsProperties.Declared d : declared.jobs()) {
            JobDefinition def = new JobDefinition(null, d.name(), d.description(), d.scriptPath(),
                    d.cronExpression(), d.enabled(), d.config());
            try {
                Job job = d.name() == null
                        ? jobStore.upsertJob(def)
                        : jobStore.findByName(d.name().trim())
                                .map(existing -> jobStore.upsertJob(def.withId(existing.getId())))
                                .orElseGet(() -> jobStore.upsertJob(def));
                log.debug("Loaded configured job '{}' (id={})", job.getName(), job.getId());
                loaded++;
            } catch (JobValidationException | JobConflictException e) {
                log.error("Skipping configured job '{}': {}", d.name(), e.getMessage());
            }
        }
        log.info("Loaded {}/{} job(s) from configuration", loaded, declared.jobs().size());
    }
}
