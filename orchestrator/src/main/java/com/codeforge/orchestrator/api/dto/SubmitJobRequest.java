package com.codeforge.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * Required: projectId, agentType (research, wireframe, code, qa, pedagogy,
 * roadmap or pipeline). Optional: inputContext, ownerId.
 */
public record SubmitJobRequest(String projectId, String agentType,
                               Map<String, Object> inputContext, String ownerId) {

    public SubmitJobRequest {
        if (inputContext == null) inputContext = Map.of();
    }
}
