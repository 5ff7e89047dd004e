package com.codeforge.orchestrator.workflow;

import com.codeforge.orchestrator.model.AgentType;

/** The two graph shapes jobs run. */
public final class WorkflowGraphs {

    /** Headroom above two nodes per iteration for research, wireframe and the final QA pass. */
    static final int STEP_LIMIT_SLACK = 5;

    private WorkflowGraphs() {}

    public static WorkflowGraph forAgent(AgentType type, int maxIterations) {
        return type.isPipeline() ? builderPipeline(maxIterations) : singleNode(type.wireName());
    }

    public static WorkflowGraph singleNode(String node) {
        return WorkflowGraph.startingAt(node)
                .stepLimit(1 + STEP_LIMIT_SLACK)
                .build();
    }

    /**
     * <pre>
     *   research → wireframe → code → qa ─┬─ passed / out of iterations → END
     *                           ▲          │
     *                           └──failed──┘
     * </pre>
     */
    public static WorkflowGraph builderPipeline(int maxIterations) {
        String research  = AgentType.RESEARCH.wireName();
        String wireframe = AgentType.WIREFRAME.wireName();
        String code      = AgentType.CODE.wireName();
        String qa        = AgentType.QA.wireName();
        return WorkflowGraph.startingAt(research)
                .edge(research, wireframe)
                .edge(wireframe, code)
                .edge(code, qa)
                .conditionalEdge(qa, new QaRetryRouter())
                .stepLimit(maxIterations * 2 + STEP_LIMIT_SLACK)
                .build();
    }
}
