package com.codeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The generation steps a job can run, plus the PIPELINE sentinel.
 *
 * Each step carries the provider its calls are routed to (circuit breakers
 * are keyed by provider, not by step), the progress value reported once the
 * step's node finishes, and the key its output is stored under in the
 * pipeline state.
 */
public enum AgentType {
    RESEARCH ("research",  "openai",    20.0,  "requirements_spec"),
    WIREFRAME("wireframe", "openai",    40.0,  "architecture_spec"),
    CODE     ("code",      "google",    60.0,  "generated_code"),
    QA       ("qa",        "openai",    80.0,  "qa_result"),
    PEDAGOGY ("pedagogy",  "anthropic", 100.0, "pedagogy_response"),
    ROADMAP  ("roadmap",   "anthropic", 100.0, "roadmap"),
    PIPELINE ("pipeline",  null,        100.0, null);

    private final String wireName;
    private final String provider;
    private final double progress;
    private final String outputKey;

    AgentType(String wireName, String provider, double progress, String outputKey) {
        this.wireName  = wireName;
        this.provider  = provider;
        this.progress  = progress;
        this.outputKey = outputKey;
    }

    @JsonValue
    public String wireName()  { return wireName; }
    public String provider()  { return provider; }
    public double progress()  { return progress; }
    public String outputKey() { return outputKey; }

    public boolean isPipeline() { return this == PIPELINE; }

    @JsonCreator
    public static AgentType fromWireName(String name) {
        if (name != null) {
            for (AgentType type : values()) {
                if (type.wireName.equalsIgnoreCase(name.strip())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + name);
    }
}
