package com.scriptohio.orchestrator.model;

public enum ErrorKind {
    PERMISSION_DENIED,
    CAPABILITY_MISMATCH,
    AGENT_UNAVAILABLE,
    TIMEOUT,
    VALIDATION_ERROR,
    INTERNAL_AGENT_ERROR,
    DEPENDENCY_FAILED,
    CANCELLED
}
