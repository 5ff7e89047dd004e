package com.codeforge.orchestrator.workflow;

import com.codeforge.orchestrator.model.AgentType;
import com.codeforge.orchestrator.resilience.ResilientCaller;
import com.codeforge.orchestrator.step.GenerationStep;
import com.codeforge.orchestrator.step.StepException;
import com.codeforge.orchestrator.step.StepRequest;
import com.codeforge.orchestrator.step.StepTimeoutException;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Node that runs one generation step through the resilience layer.
 *
 * Each attempt runs on the step pool and is abandoned once it passes the
 * step timeout; the timeout counts as a transient failure. The code node
 * advances the iteration count, and a research output carrying
 * {@code clarification_questions} pauses the run for user input.
 */
public class GenerationNode implements WorkflowNode {

    static final String CLARIFICATION_QUESTIONS = "clarification_questions";

    private final AgentType       type;
    private final GenerationStep  step;
    private final ResilientCaller caller;
    private final ExecutorService stepPool;
    private final Duration        stepTimeout;

    public GenerationNode(GenerationStep step, ResilientCaller caller,
                          ExecutorService stepPool, Duration stepTimeout) {
        this.type        = step.agentType();
        this.step        = step;
        this.caller      = caller;
        this.stepPool    = stepPool;
        this.stepTimeout = stepTimeout;
    }

    @Override
    public String name() { return type.wireName(); }

    @Override
    public double progress() { return type.progress(); }

    @Override
    public StatePatch apply(PipelineState state) {
        StepRequest request = state.toStepRequest(type);
        Map<String, Object> output = caller.call(type.provider(), () -> attempt(request));

        StatePatch.Builder patch = StatePatch.builder().output(type.outputKey(), output);
        if (type == AgentType.CODE) {
            patch.iterationCount(state.getIterationCount() + 1);
        }
        if (type == AgentType.RESEARCH && output != null
                && output.get(CLARIFICATION_QUESTIONS) instanceof Collection<?> questions
                && !questions.isEmpty()) {
            patch.awaitInput(Map.of("questions", questions));
        }
        return patch.build();
    }

    private Map<String, Object> attempt(StepRequest request) {
        Future<Map<String, Object>> future = stepPool.submit(() -> step.generate(request));
        try {
            return future.get(stepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(type.provider(), name(), stepTimeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for step '" + name() + "'");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new StepException(StepException.Kind.UNKNOWN, type.provider(),
                    "Step '" + name() + "' failed: " + cause, cause);
        }
    }
}
