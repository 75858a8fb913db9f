package com.scriptohio.orchestrator.model;

public enum ResourceKind {
    NOTEBOOK,
    MODEL,
    FEATURE,
    DOCUMENT,
    DATA
}
