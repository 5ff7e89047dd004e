package com.codeforge.orchestrator.workflow;

/** The graph itself is broken: unknown node, or the step ceiling was hit. */
public class WorkflowGraphException extends RuntimeException {

    public WorkflowGraphException(String message) {
        super(message);
    }
}
