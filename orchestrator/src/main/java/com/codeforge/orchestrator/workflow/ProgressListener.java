package com.codeforge.orchestrator.workflow;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(double progress, String node);

    ProgressListener NONE = (progress, node) -> {};
}
