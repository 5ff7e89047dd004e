package com.codeforge.orchestrator.api;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.InvalidJobStateException;
import com.codeforge.orchestrator.model.Job;
import com.codeforge.orchestrator.model.JobPage;
import com.codeforge.orchestrator.model.JobStatus;
import com.codeforge.orchestrator.service.InvalidJobRequestException;
import com.codeforge.orchestrator.service.JobEventPublisher;
import com.codeforge.orchestrator.service.JobNotFoundException;
import com.codeforge.orchestrator.service.JobService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Slice test for JobController. Only the web layer starts; the service and
 * the event publisher are mocks.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc             mockMvc;
    @MockitoBean JobService        jobService;
    @MockitoBean JobEventPublisher events;

    private static Job fakeJob(String id, AgentType type, JobStatus status) {
        Job job = new Job(id, "proj-1", type, Map.of("prompt", "todo app"), "u-1",
                Instant.parse("2026-03-01T12:00:00Z"));
        job.setStatus(status);
        return job;
    }

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submitJob_validRequest_returns201WithJobId() throws Exception {
        when(jobService.submit(eq("proj-1"), eq("pipeline"), any(), eq("u-1")))
                .thenReturn(fakeJob("j-1", AgentType.PIPELINE, JobStatus.QUEUED));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"proj-1","agentType":"pipeline",
                                 "inputContext":{"prompt":"todo app"},"ownerId":"u-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value("j-1"))
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andExpect(jsonPath("$.progress").value(0.0));
    }

    @Test
    void submitJob_invalidRequest_returns400() throws Exception {
        when(jobService.submit(any(), eq("poetry"), any(), any()))
                .thenThrow(new InvalidJobRequestException("Unknown agent type: poetry"));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"projectId":"proj-1","agentType":"poetry"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_completed_returnsResultWithoutError() throws Exception {
        Job job = fakeJob("j-1", AgentType.CODE, JobStatus.COMPLETED);
        job.setProgress(100.0);
        job.setResult(Map.of("generated_code", "src"));
        when(jobService.getStatus("j-1")).thenReturn(job);

        mockMvc.perform(get("/jobs/{id}", "j-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agentType").value("code"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.result.generated_code").value("src"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        when(jobService.getStatus("missing")).thenThrow(new JobNotFoundException("missing"));

        mockMvc.perform(get("/jobs/{id}", "missing"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /projects/{projectId}/jobs
    // ------------------------------------------------------------------

    @Test
    void listJobs_defaultsToFirstPage() throws Exception {
        JobPage page = new JobPage(List.of(fakeJob("j-2", AgentType.QA, JobStatus.RUNNING),
                fakeJob("j-1", AgentType.CODE, JobStatus.COMPLETED)), 1, 20, 2);
        when(jobService.list("proj-1", 1, 20)).thenReturn(page);

        mockMvc.perform(get("/projects/{projectId}/jobs", "proj-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobs.length()").value(2))
                .andExpect(jsonPath("$.jobs[0].jobId").value("j-2"))
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.hasNext").value(false));
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/cancel and /resume
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_returns202() throws Exception {
        when(jobService.cancel("j-1")).thenReturn(fakeJob("j-1", AgentType.CODE, JobStatus.CANCELLED));

        mockMvc.perform(post("/jobs/{id}/cancel", "j-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void cancel_settledJob_returns409() throws Exception {
        when(jobService.cancel("j-1")).thenThrow(
                new InvalidJobStateException(JobStatus.COMPLETED, "Job j-1 is COMPLETED and cannot be cancelled"));

        mockMvc.perform(post("/jobs/{id}/cancel", "j-1"))
                .andExpect(status().isConflict());
    }

    @Test
    void resume_waitingJob_returns201WithNewJob() throws Exception {
        when(jobService.resume("j-1", Map.of("platform", "web")))
                .thenReturn(fakeJob("j-2", AgentType.PIPELINE, JobStatus.QUEUED));

        mockMvc.perform(post("/jobs/{id}/resume", "j-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"answers":{"platform":"web"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.jobId").value("j-2"));
    }

    @Test
    void resume_withoutBody_passesNullAnswers() throws Exception {
        when(jobService.resume(eq("j-1"), isNull()))
                .thenReturn(fakeJob("j-2", AgentType.PIPELINE, JobStatus.QUEUED));

        mockMvc.perform(post("/jobs/{id}/resume", "j-1"))
                .andExpect(status().isCreated());
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}/events
    // ------------------------------------------------------------------

    @Test
    void events_settledJob_sendsTerminalEventWithoutSubscribing() throws Exception {
        Job job = fakeJob("j-1", AgentType.CODE, JobStatus.FAILED);
        job.setError("Agent execution failed");
        when(jobService.getStatus("j-1")).thenReturn(job);

        MvcResult result = mockMvc.perform(get("/jobs/{id}/events", "j-1")).andReturn();

        assertThat(result.getResponse().getContentAsString())
                .contains("event:terminal")
                .contains("Agent execution failed");
        verify(events, never()).subscribe(any(), any());
    }

    @Test
    void events_runningJob_subscribesToPublisher() throws Exception {
        when(jobService.getStatus("j-1")).thenReturn(fakeJob("j-1", AgentType.CODE, JobStatus.RUNNING));
        when(events.subscribe(eq("j-1"), any())).thenReturn(() -> {});

        mockMvc.perform(get("/jobs/{id}/events", "j-1"));

        verify(events).subscribe(eq("j-1"), any());
    }
}
