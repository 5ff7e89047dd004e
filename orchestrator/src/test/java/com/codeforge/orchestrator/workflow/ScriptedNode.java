package com.codeforge.orchestrator.workflow;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Test node whose behaviour is a lambda; counts its invocations. */
class ScriptedNode implements WorkflowNode {

    private final String                              name;
    private final double                              progress;
    private final Function<PipelineState, StatePatch> body;
    final AtomicInteger                               calls = new AtomicInteger();

    ScriptedNode(String name, double progress, Function<PipelineState, StatePatch> body) {
        this.name     = name;
        this.progress = progress;
        this.body     = body;
    }

    static ScriptedNode output(String name, double progress, String key, Object value) {
        return new ScriptedNode(name, progress, s -> StatePatch.builder().output(key, value).build());
    }

    @Override public String name()     { return name; }
    @Override public double progress() { return progress; }

    @Override
    public StatePatch apply(PipelineState state) {
        calls.incrementAndGet();
        return body.apply(state);
    }
}
