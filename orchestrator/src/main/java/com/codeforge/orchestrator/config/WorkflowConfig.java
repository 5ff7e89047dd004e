package com.codeforge.orchestrator.config;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.resilience.ResilientCaller;
import com.codeforge.orchestrator.step.GenerationServiceClient;
import com.codeforge.orchestrator.step.GenerationStep;
import com.codeforge.orchestrator.step.HttpGenerationStep;
import com.codeforge.orchestrator.workflow.GenerationNode;
import com.codeforge.orchestrator.workflow.NodeRegistry;
import com.codeforge.orchestrator.workflow.WorkflowExecutor;
import com.codeforge.orchestrator.workflow.WorkflowNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * One node per generation agent type. A {@link GenerationStep} bean for a
 * type replaces the HTTP default for that type.
 */
@Configuration
public class WorkflowConfig {

    @Bean
    public GenerationServiceClient generationServiceClient(
            @Value("${codeforge.generation.base-url:http://localhost:8090}") String baseUrl,
            @Value("${codeforge.pipeline.step-timeout:300s}") Duration stepTimeout,
            ObjectMapper objectMapper) {
        return new GenerationServiceClient(baseUrl, stepTimeout, objectMapper);
    }

    @Bean
    public NodeRegistry nodeRegistry(ObjectProvider<GenerationStep> customSteps,
                                     GenerationServiceClient client,
                                     ResilientCaller caller,
                                     @Qualifier("stepCallPool") ExecutorService stepPool,
                                     @Value("${codeforge.pipeline.step-timeout:300s}") Duration stepTimeout) {
        Map<AgentType, GenerationStep> steps = new EnumMap<>(AgentType.class);
        customSteps.orderedStream().forEach(step -> steps.put(step.agentType(), step));

        List<WorkflowNode> nodes = new ArrayList<>();
        for (AgentType type : AgentType.values()) {
            if (type.isPipeline()) continue;
            GenerationStep step = steps.computeIfAbsent(type, t -> new HttpGenerationStep(t, client));
            nodes.add(new GenerationNode(step, caller, stepPool, stepTimeout));
        }
        return new NodeRegistry(nodes);
    }

    @Bean
    public WorkflowExecutor workflowExecutor(NodeRegistry nodeRegistry) {
        return new WorkflowExecutor(nodeRegistry);
    }
}
