package com.codeforge.orchestrator.workflow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nodes by name plus the outgoing edge of each. A node without an edge
 * leads to {@link #END}.
 */
public final class WorkflowGraph {

    public static final String END = "__end__";

    private final String                  entry;
    private final Map<String, EdgeRouter> edges;
    private final int                     stepLimit;

    private WorkflowGraph(String entry, Map<String, EdgeRouter> edges, int stepLimit) {
        this.entry     = entry;
        this.edges     = Map.copyOf(edges);
        this.stepLimit = stepLimit;
    }

    public static Builder startingAt(String entry) {
        return new Builder(entry);
    }

    public String entry()     { return entry; }

    /** Most node executions one run may perform before it is aborted as runaway. */
    public int    stepLimit() { return stepLimit; }

    public String next(String node, PipelineState state) {
        EdgeRouter router = edges.get(node);
        if (router == null) return END;
        String next = router.next(state);
        return next == null ? END : next;
    }

    public static final class Builder {
        private final String                  entry;
        private final Map<String, EdgeRouter> edges = new LinkedHashMap<>();
        private int stepLimit = 25;

        private Builder(String entry) {
            this.entry = entry;
        }

        public Builder edge(String from, String to) {
            edges.put(from, EdgeRouter.to(to));
            return this;
        }

        public Builder conditionalEdge(String from, EdgeRouter router) {
            edges.put(from, router);
            return this;
        }

        public Builder stepLimit(int limit) {
            this.stepLimit = limit;
            return this;
        }

        public WorkflowGraph build() {
            return new WorkflowGraph(entry, edges, stepLimit);
        }
    }
}
