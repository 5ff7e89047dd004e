package com.codeforge.orchestrator.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What one node wants changed in the pipeline state. Nodes return a patch;
 * only the executor applies it.
 */
public final class StatePatch {

    private final Map<String, Object> outputs;
    private final Integer             iterationCount;
    private final Map<String, Object> clarification;

    private StatePatch(Builder b) {
        this.outputs        = Collections.unmodifiableMap(new LinkedHashMap<>(b.outputs));
        this.iterationCount = b.iterationCount;
        this.clarification  = b.clarification;
    }

    public static Builder builder() { return new Builder(); }

    public static StatePatch empty() { return builder().build(); }

    public Map<String, Object> outputs()       { return outputs; }
    public Integer             iterationCount() { return iterationCount; }

    /** Non-null when the node needs answers from the user before the run can go on. */
    public Map<String, Object> clarification()  { return clarification; }

    public static final class Builder {
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private Integer             iterationCount;
        private Map<String, Object> clarification;

        private Builder() {}

        public Builder output(String key, Object value) {
            outputs.put(key, value);
            return this;
        }

        public Builder iterationCount(int value) {
            this.iterationCount = value;
            return this;
        }

        public Builder awaitInput(Map<String, Object> clarification) {
            this.clarification = Map.copyOf(clarification);
            return this;
        }

        public StatePatch build() { return new StatePatch(this); }
    }
}
