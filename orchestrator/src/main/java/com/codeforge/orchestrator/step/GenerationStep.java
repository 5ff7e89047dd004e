package com.codeforge.orchestrator.step;

import com.codeforge.orchestrator.model.AgentType;

import java.util.Map;

/**
 * One generation stage. Declaring a Spring bean of this type for an agent
 * type replaces the HTTP-backed default for that type.
 */
public interface GenerationStep {

    AgentType agentType();

    /**
     * Produce this step's output. May block on a remote call.
     *
     * @throws StepException on any failure the resilience layer should classify
     */
    Map<String, Object> generate(StepRequest request);
}
