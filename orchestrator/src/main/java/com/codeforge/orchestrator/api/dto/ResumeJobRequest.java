package com.codeforge.orchestrator.api.dto;

import java.util.Map;

/** Request body for POST /jobs/{id}/resume: the user's answers to the clarification questions. */
public record ResumeJobRequest(Map<String, Object> answers) {}
