package com.codeforge.orchestrator.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTransitionsTest {

    static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    static final Instant T1 = Instant.parse("2026-01-01T10:05:00Z");

    Job job;

    @BeforeEach
    void setUp() {
        job = new Job("j-1", "p-1", AgentType.RESEARCH, Map.of("prompt", "todo app"), "u-1", T0);
    }

    // ------------------------------------------------------------------
    // QUEUED → RUNNING
    // ------------------------------------------------------------------

    @Test
    void firstProgressReport_movesQueuedToRunning_andStampsStartedAt() {
        boolean changed = JobTransitions.apply(job, JobUpdate.progress(5), T1);

        assertThat(changed).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
        assertThat(job.getProgress()).isEqualTo(5.0);
        assertThat(job.getStartedAt()).isEqualTo(T1);
        assertThat(job.getCompletedAt()).isNull();
    }

    @Test
    void startedAt_isNotOverwrittenBySecondRunningUpdate() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobTransitions.apply(job, JobUpdate.running(20), T1);

        assertThat(job.getStartedAt()).isEqualTo(T0);
        assertThat(job.getProgress()).isEqualTo(20.0);
    }

    // ------------------------------------------------------------------
    // Progress
    // ------------------------------------------------------------------

    @Test
    void progress_neverDecreases() {
        JobTransitions.apply(job, JobUpdate.running(40), T0);
        JobTransitions.apply(job, JobUpdate.progress(20), T1);

        assertThat(job.getProgress()).isEqualTo(40.0);
    }

    @Test
    void progress_isClampedTo100() {
        JobTransitions.apply(job, JobUpdate.running(250), T0);
        assertThat(job.getProgress()).isEqualTo(100.0);
    }

    @Test
    void cancel_freezesProgress() {
        JobTransitions.apply(job, JobUpdate.running(40), T0);
        JobTransitions.apply(job, JobUpdate.status(JobStatus.CANCELLED).withProgress(80), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getProgress()).isEqualTo(40.0);
        assertThat(job.getCompletedAt()).isEqualTo(T1);
    }

    // ------------------------------------------------------------------
    // Errors and results
    // ------------------------------------------------------------------

    @Test
    void error_forcesFailed_andStampsCompletedAt() {
        JobTransitions.apply(job, JobUpdate.running(20), T0);
        JobTransitions.apply(job, JobUpdate.failed("Agent execution failed"), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Agent execution failed");
        assertThat(job.getResult()).isNull();
        assertThat(job.getCompletedAt()).isEqualTo(T1);
    }

    @Test
    void error_onQueuedJob_isAllowed() {
        JobTransitions.apply(job, JobUpdate.failed("boom"), T1);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void completed_setsResultAndProgress100() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobTransitions.apply(job, JobUpdate.completed(Map.of("requirements_spec", Map.of())), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100.0);
        assertThat(job.getResult()).containsKey("requirements_spec");
        assertThat(job.getError()).isNull();
        assertThat(job.getDurationSeconds()).isEqualTo(300.0);
    }

    @Test
    void result_onNonCompletionStatus_isRejected() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobUpdate bad = new JobUpdate(JobStatus.RUNNING, null, Map.of("x", 1), null, null, null);

        assertThatThrownBy(() -> JobTransitions.apply(job, bad, T1))
                .isInstanceOf(InvalidJobStateException.class);
        assertThat(job.getResult()).isNull();
    }

    @Test
    void queuedToCompleted_isIllegal() {
        assertThatThrownBy(() -> JobTransitions.apply(job, JobUpdate.completed(Map.of()), T1))
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessageContaining("QUEUED");
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    // ------------------------------------------------------------------
    // Frozen jobs
    // ------------------------------------------------------------------

    @Test
    void terminalJob_ignoresEveryFurtherUpdate() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobTransitions.apply(job, JobUpdate.completed(Map.of("a", 1)), T0);

        boolean changed = JobTransitions.apply(job, JobUpdate.failed("late failure"), T1);

        assertThat(changed).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getError()).isNull();
        assertThat(job.getResult()).containsEntry("a", 1);
        assertThat(job.getCompletedAt()).isEqualTo(T0);
    }

    @Test
    void waitingForInput_recordsClarification_andFreezesJob() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobTransitions.apply(job, JobUpdate.waitingForInput(
                Map.of("requirements_spec", Map.of()), Map.of("questions", java.util.List.of("Which DB?"))), T1);

        assertThat(job.getStatus()).isEqualTo(JobStatus.WAITING_FOR_INPUT);
        assertThat(job.getClarificationData()).containsKey("questions");
        assertThat(job.getCompletedAt()).isEqualTo(T1);

        assertThat(JobTransitions.apply(job, JobUpdate.status(JobStatus.CANCELLED), T1)).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.WAITING_FOR_INPUT);
    }

    @Test
    void checkpoint_isKeptWhenJobFailsLater() {
        JobTransitions.apply(job, JobUpdate.running(5), T0);
        JobTransitions.apply(job, JobUpdate.progress(20).withCheckpoint(Map.of("requirements_spec", "r")), T0);
        JobTransitions.apply(job, JobUpdate.failed("Agent execution failed"), T1);

        assertThat(job.getCheckpoint()).containsEntry("requirements_spec", "r");
        assertThat(job.getProgress()).isEqualTo(20.0);
    }
}
