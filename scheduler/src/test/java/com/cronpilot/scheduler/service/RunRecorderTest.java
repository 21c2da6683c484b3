package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.Job;
import com.cronpilot.scheduler.model.JobRun;
import com.cronpilot.scheduler.model.RunStatus;
import com.cronpilot.scheduler.repository.JobRepository;
import com.cronpilot.scheduler.repository.JobRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.SliceImpl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RunRecorderTest {

    private static final Instant T0 = Instant.parse("2024-01-02T02:00:00Z");

    @Mock JobRunRepository runRepo;
    @Mock JobRepository    jobRepo;

    @InjectMocks RunRecorder recorder;

    Job job;

    @BeforeEach
    void setUp() {
        job = JobStoreTest.job(7L, "daily-backup", "0 2 * * *", null);
    }

    // ------------------------------------------------------------------
    // beginRun()
    // ------------------------------------------------------------------

    @Test
    void beginRun_persistsRunningRunAndReturnsId() {
        when(jobRepo.findById(7L)).thenReturn(Optional.of(job));
        when(runRepo.save(any(JobRun.class))).thenAnswer(inv -> withId(inv.getArgument(0), 100L));

        Long runId = recorder.beginRun(7L, T0);

        assertThat(runId).isEqualTo(100L);
        ArgumentCaptor<JobRun> captor = ArgumentCaptor.forClass(JobRun.class);
        verify(runRepo).save(captor.capture());
        JobRun saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(saved.getStartedAt()).isEqualTo(T0);
        assertThat(saved.getJobId()).isEqualTo(7L);
        assertThat(saved.getCompletedAt()).isNull();
        assertThat(saved.getDurationSeconds()).isNull();
    }

    @Test
    void beginRun_unknownJob_throwsNotFound() {
        when(jobRepo.findById(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> recorder.beginRun(7L, T0)).isInstanceOf(JobNotFoundException.class);
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // completeRun()
    // ------------------------------------------------------------------

    @Test
    void completeRun_success_setsDurationAndNoError() {
        JobRun run = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(run));
        when(runRepo.save(run)).thenReturn(run);

        JobRun done = recorder.completeRun(100L, RunStatus.SUCCESS, "ok", null, T0.plusSeconds(30));

        assertThat(done.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(done.getDurationSeconds()).isEqualTo(30);
        assertThat(done.getCompletedAt()).isEqualTo(T0.plusSeconds(30));
        assertThat(done.getOutput()).isEqualTo("ok");
        assertThat(done.getErrorMessage()).isNull();
    }

    @Test
    void completeRun_fractionalSeconds_floored() {
        JobRun run = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(run));
        when(runRepo.save(run)).thenReturn(run);

        JobRun done = recorder.completeRun(100L, RunStatus.FAILED, null, "boom", T0.plusMillis(2_999));

        assertThat(done.getDurationSeconds()).isEqualTo(2);
        assertThat(done.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void completeRun_endBeforeStart_durationIsZero() {
        JobRun run = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(run));
        when(runRepo.save(run)).thenReturn(run);

        JobRun done = recorder.completeRun(100L, RunStatus.SUCCESS, null, null, T0.minusSeconds(5));

        assertThat(done.getDurationSeconds()).isZero();
    }

    @Test
    void completeRun_twice_secondRejectedAndRowUnchanged() {
        JobRun run = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(run));
        when(runRepo.save(run)).thenReturn(run);
        recorder.completeRun(100L, RunStatus.SUCCESS, "ok", null, T0.plusSeconds(30));

        assertThatThrownBy(() -> recorder.completeRun(100L, RunStatus.FAILED, null, "late", T0.plusSeconds(90)))
                .isInstanceOf(InvalidRunTransitionException.class)
                .satisfies(e -> assertThat(((InvalidRunTransitionException) e).getCurrentStatus())
                        .isEqualTo(RunStatus.SUCCESS));

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(run.getDurationSeconds()).isEqualTo(30);
        assertThat(run.getErrorMessage()).isNull();
        verify(runRepo, times(1)).save(run);
    }

    @Test
    void completeRun_unknownRun_throwsRunNotFound() {
        when(runRepo.findByIdForUpdate(404L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> recorder.completeRun(404L, RunStatus.SUCCESS, null, null, T0))
                .isInstanceOf(RunNotFoundException.class);
    }

    @Test
    void completeRun_nonTerminalOutcome_rejectedWithoutTouchingStore() {
        assertThatThrownBy(() -> recorder.completeRun(100L, RunStatus.RUNNING, null, null, T0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(runRepo);
    }

    // ------------------------------------------------------------------
    // listRuns()
    // ------------------------------------------------------------------

    @Test
    void listRuns_isLazyAndRestartable() {
        List<JobRun> all = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            all.add(withId(new JobRun(job, RunStatus.SUCCESS, T0.minusSeconds(i * 60L)), 1000L - i));
        }
        when(jobRepo.existsById(7L)).thenReturn(true);
        when(runRepo.findByJobIdOrderByStartedAtDescIdDesc(eq(7L), any(Pageable.class)))
                .thenAnswer(inv -> page(all, inv.getArgument(1)));

        RunHistory history = recorder.listRuns(7L, 75, null);

        // Nothing is fetched until iteration starts.
        verify(runRepo, never()).findByJobIdOrderByStartedAtDescIdDesc(anyLong(), any());

        List<JobRun> first  = history.toList();
        List<JobRun> second = history.toList();

        assertThat(first).hasSize(75);
        assertThat(first.get(0).getId()).isEqualTo(1000L);
        assertThat(first).isEqualTo(second);
        // 50 + 25 per pass
        verify(runRepo, times(4)).findByJobIdOrderByStartedAtDescIdDesc(eq(7L), any(Pageable.class));
    }

    @Test
    void listRuns_withStatusFilter_usesFilteredQuery() {
        JobRun failed = withId(new JobRun(job, RunStatus.FAILED, T0), 5L);
        when(jobRepo.existsById(7L)).thenReturn(true);
        when(runRepo.findByJobIdAndStatusOrderByStartedAtDescIdDesc(eq(7L), eq(RunStatus.FAILED), any(Pageable.class)))
                .thenAnswer(inv -> page(List.of(failed), inv.getArgument(2)));

        List<JobRun> runs = recorder.listRuns(7L, 50, RunStatus.FAILED).toList();

        assertThat(runs).containsExactly(failed);
        verify(runRepo, never()).findByJobIdOrderByStartedAtDescIdDesc(anyLong(), any());
    }

    @Test
    void listRuns_deletedJob_throwsNotFound() {
        when(jobRepo.existsById(7L)).thenReturn(false);

        assertThatThrownBy(() -> recorder.listRuns(7L, 50, null)).isInstanceOf(JobNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // failOrphanedRuns()
    // ------------------------------------------------------------------

    @Test
    void failOrphanedRuns_marksStaleRunningRunsFailed() {
        Instant now    = T0.plusSeconds(3 * 3600);
        Instant cutoff = now.minusSeconds(2 * 3600);
        JobRun orphan  = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        when(runRepo.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff)).thenReturn(List.of(orphan));
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(orphan));
        when(runRepo.save(orphan)).thenReturn(orphan);

        int failed = recorder.failOrphanedRuns(cutoff, now);

        assertThat(failed).isEqualTo(1);
        assertThat(orphan.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(orphan.getErrorMessage()).startsWith("Interrupted");
        assertThat(orphan.getCompletedAt()).isEqualTo(now);
        assertThat(orphan.getDurationSeconds()).isEqualTo(3 * 3600);
    }

    @Test
    void failOrphanedRuns_runCompletedConcurrently_skipped() {
        Instant now    = T0.plusSeconds(3 * 3600);
        Instant cutoff = now.minusSeconds(2 * 3600);
        JobRun candidate = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        JobRun locked    = withId(new JobRun(job, RunStatus.RUNNING, T0), 100L);
        locked.complete(RunStatus.SUCCESS, "ok", null, T0.plusSeconds(10));
        when(runRepo.findByStatusAndStartedAtBefore(RunStatus.RUNNING, cutoff)).thenReturn(List.of(candidate));
        when(runRepo.findByIdForUpdate(100L)).thenReturn(Optional.of(locked));

        assertThat(recorder.failOrphanedRuns(cutoff, now)).isZero();
        assertThat(locked.getStatus()).isEqualTo(RunStatus.SUCCESS);
        verify(runRepo, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static SliceImpl<JobRun> page(List<JobRun> all, Pageable pageable) {
        int from = (int) Math.min(pageable.getOffset(), all.size());
        int to   = Math.min(from + pageable.getPageSize(), all.size());
        return new SliceImpl<>(all.subList(from, to), pageable, to < all.size());
    }

    static JobRun withId(JobRun run, Long id) {
        try {
            var f = JobRun.class.getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, id);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
