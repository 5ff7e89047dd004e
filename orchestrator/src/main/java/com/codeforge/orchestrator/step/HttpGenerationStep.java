package com.codeforge.orchestrator.step;

import com.codeforge.orchestrator.model.AgentType;

import java.util.Map;

/** Default step: delegates to the remote generation service. */
public class HttpGenerationStep implements GenerationStep {

    private final AgentType               agentType;
    private final GenerationServiceClient client;

    public HttpGenerationStep(AgentType agentType, GenerationServiceClient client) {
        if (agentType.isPipeline()) {
            throw new IllegalArgumentException("'pipeline' is not a generation step");
        }
        this.agentType = agentType;
        this.client    = client;
    }

    @Override
    public AgentType agentType() { return agentType; }

    @Override
    public Map<String, Object> generate(StepRequest request) {
        return client.generate(request);
    }
}
