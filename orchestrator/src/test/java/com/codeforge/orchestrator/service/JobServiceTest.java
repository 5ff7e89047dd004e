package com.codeforge.orchestrator.service;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.InvalidJobStateException;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.model.JobUpdate;
import com.codeforge.orchestrator.store.JobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobStore          store;
    @Mock JobRunner         runner;
    @Mock JobEventPublisher events;

    JobService service;

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @BeforeEach
    void setUp() {
        service = new JobService(store, runner, events, new ObjectMapper(), 200);
    }

    private static Job job(String id, AgentType type, JobStatus status, Map<String, Object> input) {
        Job job = new Job(id, "proj-1", type, input, "u-1", T0);
        job.setStatus(status);
        return job;
    }

    // ------------------------------------------------------------------
    // submit
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_createsQueuedJobAndStartsRunner() {
        when(store.create(anyString(), eq("proj-1"), eq(AgentType.PIPELINE), any(), eq("u-1")))
                .thenAnswer(inv -> job(inv.getArgument(0), AgentType.PIPELINE, JobStatus.QUEUED, inv.getArgument(3)));

        Job created = service.submit("proj-1", "pipeline", Map.of("prompt", "todo app"), "u-1");

        assertThat(created.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(created.getInputContext()).containsEntry("prompt", "todo app");
        verify(runner).start(created.getJobId());
    }

    @Test
    void submit_nullInput_isStoredAsEmptyContext() {
        when(store.create(anyString(), any(), any(), any(), any()))
                .thenAnswer(inv -> job(inv.getArgument(0), AgentType.QA, JobStatus.QUEUED, inv.getArgument(3)));

        service.submit("proj-1", "qa", null, null);

        ArgumentCaptor<Map<String, Object>> input = ArgumentCaptor.forClass(Map.class);
        verify(store).create(anyString(), eq("proj-1"), eq(AgentType.QA), input.capture(), eq(null));
        assertThat(input.getValue()).isEmpty();
    }

    @Test
    void submit_unknownAgentType_isRejected() {
        assertThatThrownBy(() -> service.submit("proj-1", "poetry", Map.of(), "u-1"))
                .isInstanceOf(InvalidJobRequestException.class)
                .hasMessageContaining("poetry");
        verifyNoInteractions(store, runner);
    }

    @Test
    void submit_blankProject_isRejected() {
        assertThatThrownBy(() -> service.submit(" ", "code", Map.of(), "u-1"))
                .isInstanceOf(InvalidJobRequestException.class);
        verifyNoInteractions(store, runner);
    }

    @Test
    void submit_oversizedInput_isRejected() {
        Map<String, Object> input = Map.of("prompt", "x".repeat(500));

        assertThatThrownBy(() -> service.submit("proj-1", "code", input, "u-1"))
                .isInstanceOf(InvalidJobRequestException.class)
                .hasMessageContaining("limit is 200");
        verifyNoInteractions(store, runner);
    }

    // ------------------------------------------------------------------
    // getStatus / list
    // ------------------------------------------------------------------

    @Test
    void getStatus_unknownJob_throwsNotFound() {
        when(store.get("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus("missing"))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void list_pageSizeOverLimit_isRejected() {
        assertThatThrownBy(() -> service.list("proj-1", 1, 500))
                .isInstanceOf(InvalidJobRequestException.class);
        verifyNoInteractions(store);
    }

    // ------------------------------------------------------------------
    // cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_cancelsAndPublishesTerminalEvent() {
        Job running = job("j-1", AgentType.CODE, JobStatus.RUNNING, Map.of());
        Job cancelled = job("j-1", AgentType.CODE, JobStatus.CANCELLED, Map.of());
        when(store.get("j-1")).thenReturn(Optional.of(running));
        when(store.update("j-1", JobUpdate.status(JobStatus.CANCELLED))).thenReturn(Optional.of(cancelled));

        Job result = service.cancel("j-1");

        assertThat(result.getStatus()).isEqualTo(JobStatus.CANCELLED);
        verify(events).publishTerminal(cancelled);
    }

    @Test
    void cancel_completedJob_isConflict() {
        when(store.get("j-1")).thenReturn(Optional.of(job("j-1", AgentType.CODE, JobStatus.COMPLETED, Map.of())));

        assertThatThrownBy(() -> service.cancel("j-1"))
                .isInstanceOfSatisfying(InvalidJobStateException.class,
                        e -> assertThat(e.getCurrent()).isEqualTo(JobStatus.COMPLETED));
        verify(store, never()).update(any(), any());
        verifyNoInteractions(events);
    }

    @Test
    void cancel_waitingForInput_isConflict() {
        when(store.get("j-1")).thenReturn(Optional.of(
                job("j-1", AgentType.PIPELINE, JobStatus.WAITING_FOR_INPUT, Map.of())));

        assertThatThrownBy(() -> service.cancel("j-1"))
                .isInstanceOf(InvalidJobStateException.class);
    }

    @Test
    void cancel_jobFinishingFirst_isConflict() {
        when(store.get("j-1")).thenReturn(Optional.of(job("j-1", AgentType.CODE, JobStatus.RUNNING, Map.of())));
        when(store.update("j-1", JobUpdate.status(JobStatus.CANCELLED)))
                .thenReturn(Optional.of(job("j-1", AgentType.CODE, JobStatus.COMPLETED, Map.of())));

        assertThatThrownBy(() -> service.cancel("j-1"))
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessageContaining("COMPLETED");
        verifyNoInteractions(events);
    }

    // ------------------------------------------------------------------
    // resume
    // ------------------------------------------------------------------

    @Test
    void resume_waitingJob_startsNewJobWithAnswers() {
        Job waiting = job("j-1", AgentType.PIPELINE, JobStatus.WAITING_FOR_INPUT, Map.of("prompt", "todo"));
        when(store.get("j-1")).thenReturn(Optional.of(waiting));
        when(store.create(anyString(), eq("proj-1"), eq(AgentType.PIPELINE), any(), eq("u-1")))
                .thenAnswer(inv -> job(inv.getArgument(0), AgentType.PIPELINE, JobStatus.QUEUED, inv.getArgument(3)));

        Job resumed = service.resume("j-1", Map.of("platform", "web"));

        assertThat(resumed.getJobId()).isNotEqualTo("j-1");
        assertThat(resumed.getInputContext())
                .containsEntry("prompt", "todo")
                .containsEntry("clarification_answers", Map.of("platform", "web"));
        verify(runner).start(resumed.getJobId());
    }

    @Test
    void resume_runningJob_isConflict() {
        when(store.get("j-1")).thenReturn(Optional.of(job("j-1", AgentType.PIPELINE, JobStatus.RUNNING, Map.of())));

        assertThatThrownBy(() -> service.resume("j-1", Map.of()))
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessageContaining("WAITING_FOR_INPUT");
        verifyNoInteractions(runner);
    }
}
