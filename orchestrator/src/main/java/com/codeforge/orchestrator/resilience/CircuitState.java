package com.codeforge.orchestrator.resilience;

public enum CircuitState { CLOSED, OPEN, HALF_OPEN }
