package com.codeforge.orchestrator.service;

@FunctionalInterface
public interface JobEventListener {
    void onEvent(JobEvent event);
}
