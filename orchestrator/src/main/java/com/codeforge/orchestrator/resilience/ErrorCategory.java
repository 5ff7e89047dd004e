package com.codeforge.orchestrator.resilience;

public enum ErrorCategory { TRANSIENT, PERMANENT }
