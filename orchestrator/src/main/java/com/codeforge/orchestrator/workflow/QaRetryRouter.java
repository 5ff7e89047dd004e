package com.codeforge.orchestrator.workflow;

import com.codeforge.orchestrator.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Conditional edge out of the QA node: back to code generation while QA
 * fails and iterations remain, otherwise end.
 *
 * A missing QA result, or one without a {@code passed} flag, counts as a
 * pass so a crashed reviewer cannot keep the loop spinning.
 */
public class QaRetryRouter implements EdgeRouter {

    private static final Logger log = LoggerFactory.getLogger(QaRetryRouter.class);

    @Override
    public String next(PipelineState state) {
        Object qaResult = state.output(AgentType.QA.outputKey());
        if (!(qaResult instanceof Map<?, ?>)) {
            log.warn("Job {} has no usable QA result at iteration {}; treating it as passed",
                    state.getJobId(), state.getIterationCount());
        }
        if (!passed(qaResult)
                && state.getIterationCount() < state.getMaxIterations()) {
            return AgentType.CODE.wireName();
        }
        return WorkflowGraph.END;
    }

    static boolean passed(Object qaResult) {
        if (!(qaResult instanceof Map<?, ?> map)) return true;
        Object flag = map.get("passed");
        if (flag == null) return true;
        if (flag instanceof Boolean b) return b;
        return Boolean.parseBoolean(flag.toString());
    }
}
