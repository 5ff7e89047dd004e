package com.codeforge.orchestrator.step;

import com.codeforge.orchestrator.model.AgentType;

import java.util.Map;

/**
 * What a generation step sees: the job's input and the outputs of the
 * steps that already ran in this execution.
 */
public record StepRequest(
        String              jobId,
        AgentType           agentType,
        Map<String, Object> inputContext,
        Map<String, Object> outputs,
        int                 iterationCount
) {
    public StepRequest {
        inputContext = inputContext == null ? Map.of() : inputContext;
        outputs      = outputs      == null ? Map.of() : outputs;
    }
}
