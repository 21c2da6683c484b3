package com.cronpilot.scheduler.config;

import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.service.JobDefinition;
import com.cronpilot.scheduler.service.JobStore;
import com.cronpilot.scheduler.service.JobValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobDefinitionLoaderTest {

    @Mock JobStore jobStore;

    @Test
    void run_newJob_created() {
        var declared = new JobDefinitionsProperties(List.of(
                new JobDefinitionsProperties.Declared("daily-backup", "nightly", "jobs/backup.py",
                        "0 2 * * *", true, Map.of("bucket", "s3://x"))));
        when(jobStore.findByName("daily-backup")).thenReturn(Optional.empty());
        when(jobStore.upsertJob(any())).thenReturn(job(1L, "daily-backup"));

        new JobDefinitionLoader(declared, jobStore).run(null);

        ArgumentCaptor<JobDefinition> def = ArgumentCaptor.forClass(JobDefinition.class);
        verify(jobStore).upsertJob(def.capture());
        assertThat(def.getValue().id()).isNull();
        assertThat(def.getValue().cronExpression()).isEqualTo("0 2 * * *");
        assertThat(def.getValue().config()).containsEntry("bucket", "s3://x");
    }

    @Test
    void run_existingJob_updatedInPlaceById() {
        var declared = new JobDefinitionsProperties(List.of(
                new JobDefinitionsProperties.Declared("daily-backup", null, "jobs/backup.py",
                        "0 3 * * *", null, null)));
        when(jobStore.findByName("daily-backup")).thenReturn(Optional.of(job(9L, "daily-backup")));
        when(jobStore.upsertJob(any())).thenReturn(job(9L, "daily-backup"));

        new JobDefinitionLoader(declared, jobStore).run(null);

        ArgumentCaptor<JobDefinition> def = ArgumentCaptor.forClass(JobDefinition.class);
        verify(jobStore).upsertJob(def.capture());
        assertThat(def.getValue().id()).isEqualTo(9L);
        assertThat(def.getValue().cronExpression()).isEqualTo("0 3 * * *");
    }

    @Test
    void run_badDeclaration_skippedAndOthersStillLoaded() {
        var declared = new JobDefinitionsProperties(List.of(
                new JobDefinitionsProperties.Declared("broken", null, "jobs/x.py", "whenever", null, null),
                new JobDefinitionsProperties.Declared("good", null, "jobs/y.py", "@hourly", null, null)));
        when(jobStore.findByName(any())).thenReturn(Optional.empty());
        when(jobStore.upsertJob(any()))
                .thenThrow(new JobValidationException("Invalid cron expression 'whenever'"))
                .thenReturn(job(2L, "good"));

        new JobDefinitionLoader(declared, jobStore).run(null);

        verify(jobStore, times(2)).upsertJob(any());
    }

    @Test
    void run_nothingDeclared_doesNothing() {
        new JobDefinitionLoader(new JobDefinitionsProperties(null), jobStore).run(null);

        verifyNoInteractions(jobStore);
    }

    private static Job job(Long id, String name) {
        Job job = new Job(name, "jobs/" + name + ".py", "0 2 * * *", Instant.parse("2024-01-01T00:00:00Z"));
        try {
            var f = Job.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(job, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return job;
    }
}
