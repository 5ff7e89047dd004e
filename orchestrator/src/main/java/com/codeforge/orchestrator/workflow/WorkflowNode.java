package com.codeforge.orchestrator.workflow;

/** A named stage of a workflow graph. */
public interface WorkflowNode {

    String name();

    /** Job progress to report once this node has finished. */
    double progress();

    /**
     * Compute this node's contribution. Must not keep references to
     * {@code state} past the call.
     */
    StatePatch apply(PipelineState state);
}
