package com.codeforge.orchestrator.workflow;

import java.util.Map;

/** How a run ended when it did not throw. */
public record WorkflowOutcome(
        Kind                kind,
        Map<String, Object> outputs,
        int                 iterationCount,
        String              lastNode,
        Map<String, Object> clarification
) {
    public enum Kind { COMPLETED, CANCELLED, WAITING_FOR_INPUT }

    static WorkflowOutcome of(Kind kind, PipelineState state) {
        return new WorkflowOutcome(kind, state.snapshot(), state.getIterationCount(),
                state.getCurrentNode(), state.getClarification());
    }
}
