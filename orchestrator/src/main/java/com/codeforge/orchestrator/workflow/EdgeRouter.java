package com.codeforge.orchestrator.workflow;

/** Picks the node that follows a finished one, or {@link WorkflowGraph#END}. */
@FunctionalInterface
public interface EdgeRouter {

    String next(PipelineState state);

    static EdgeRouter to(String node) {
        return state -> node;
    }
}
