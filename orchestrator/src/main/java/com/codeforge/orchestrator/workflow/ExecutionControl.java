package com.codeforge.orchestrator.workflow;

import java.util.Map;

/** Hooks through which the executor consults and updates the owning job. */
public interface ExecutionControl {

    /** Checked before each node and after each node returns. */
    boolean shouldStop();

    /**
     * Called after every merged node. Failures propagate and abort the run.
     */
    void checkpoint(String node, double progress, Map<String, Object> outputs);

    ExecutionControl NONE = new ExecutionControl() {
        @Override public boolean shouldStop() { return false; }
        @Override public void checkpoint(String node, double progress, Map<String, Object> outputs) {}
    };
}
