package com.codeforge.orchestrator.api.dto;

import com.codeforge.orchestrator.model.JobPage;

import java.util.List;

public record JobPageResponse(List<JobSummary> jobs, int page, int pageSize, long total, boolean hasNext) {

    public static JobPageResponse from(JobPage page) {
        return new JobPageResponse(
                page.jobs().stream().map(JobSummary::from).toList(),
                page.page(), page.pageSize(), page.total(), page.hasNext());
    }
}
