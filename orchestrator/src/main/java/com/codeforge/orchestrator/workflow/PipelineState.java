package com.codeforge.orchestrator.workflow;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.model.Payloads;
import com.codeforge.orchestrator.step.StepRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scratch state for one execution of a workflow graph. Created per run and
 * never shared between jobs. Nodes read it; only the executor writes it,
 * through {@link #merge(StatePatch)}.
 */
public class PipelineState {

    private final String              jobId;
    private final Map<String, Object> inputContext;
    private final int                 maxIterations;
    private final Map<String, Object> outputs = new LinkedHashMap<>();

    private int                 iterationCount;
    private String              currentNode;
    private Map<String, Object> clarification;

    public PipelineState(String jobId, Map<String, Object> inputContext, int maxIterations) {
        this.jobId         = jobId;
        this.inputContext  = inputContext == null ? Map.of() : Payloads.freeze(inputContext);
        this.maxIterations = maxIterations;
    }

    public String              getJobId()          { return jobId; }
    public Map<String, Object> getInputContext()   { return inputContext; }
    public int                 getMaxIterations()  { return maxIterations; }
    public int                 getIterationCount() { return iterationCount; }
    public String              getCurrentNode()    { return currentNode; }
    public Map<String, Object> getClarification()  { return clarification; }
    public boolean             isAwaitingInput()   { return clarification != null; }

    public Object output(String key) {
        return outputs.get(key);
    }

    /** Detached copy of the accumulated outputs; nested values are already read-only copies. */
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(outputs);
    }

    public StepRequest toStepRequest(AgentType type) {
        return new StepRequest(jobId, type, inputContext, snapshot(), iterationCount);
    }

    void enter(String node) {
        this.currentNode = node;
    }

    void merge(StatePatch patch) {
        patch.outputs().forEach((key, value) -> outputs.put(key, Payloads.freezeValue(value)));
        if (patch.iterationCount() != null) {
            iterationCount = patch.iterationCount();
        }
        if (patch.clarification() != null) {
            clarification = Payloads.freeze(patch.clarification());
        }
    }
}
