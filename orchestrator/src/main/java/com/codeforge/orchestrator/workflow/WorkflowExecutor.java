package com.codeforge.orchestrator.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives a {@link PipelineState} through a {@link WorkflowGraph}.
 *
 * Per node:
 * <ol>
 *   <li>stop if the job was cancelled</li>
 *   <li>run the node; discard its patch if the job was cancelled meanwhile</li>
 *   <li>merge the patch (the only place state changes)</li>
 *   <li>checkpoint progress and outputs to the job</li>
 *   <li>notify the progress listener; listener failures are logged and ignored</li>
 *   <li>follow the outgoing edge</li>
 * </ol>
 * Exceeding the graph's step limit throws {@link WorkflowGraphException}.
 */
public class WorkflowExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    private final NodeRegistry registry;

    public WorkflowExecutor(NodeRegistry registry) {
        this.registry = registry;
    }

    public WorkflowOutcome run(WorkflowGraph graph, PipelineState state,
                               ExecutionControl control, ProgressListener listener) {
        String current = graph.entry();
        int executed = 0;

        while (!WorkflowGraph.END.equals(current)) {
            if (++executed > graph.stepLimit()) {
                throw new WorkflowGraphException("Workflow for job " + state.getJobId()
                        + " exceeded its limit of " + graph.stepLimit() + " node executions");
            }
            WorkflowNode node = registry.get(current);

            if (control.shouldStop()) {
                log.info("Job {} stopped before node '{}'", state.getJobId(), current);
                return WorkflowOutcome.of(WorkflowOutcome.Kind.CANCELLED, state);
            }

            state.enter(current);
            MDC.put("node", current);
            StatePatch patch;
            try {
                log.debug("Entering node '{}' (iteration {})", current, state.getIterationCount());
                patch = node.apply(state);
            } finally {
                MDC.remove("node");
            }

            if (control.shouldStop()) {
                log.info("Job {} stopped while node '{}' was running; its output is discarded",
                        state.getJobId(), current);
                return WorkflowOutcome.of(WorkflowOutcome.Kind.CANCELLED, state);
            }

            state.merge(patch);
            control.checkpoint(current, node.progress(), state.snapshot());
            notifyListener(listener, node.progress(), current);

            if (state.isAwaitingInput()) {
                log.info("Job {} is waiting for user input after node '{}'", state.getJobId(), current);
                return WorkflowOutcome.of(WorkflowOutcome.Kind.WAITING_FOR_INPUT, state);
            }
            current = graph.next(current, state);
        }
        return WorkflowOutcome.of(WorkflowOutcome.Kind.COMPLETED, state);
    }

    private static void notifyListener(ProgressListener listener, double progress, String node) {
        try {
            listener.onProgress(progress, node);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed at node '{}' ({}%): {}", node, progress, e.getMessage(), e);
        }
    }
}
