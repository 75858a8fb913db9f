package com.scriptohio.orchestrator.model;

public enum ReviewVerdict {
    APPROVE,
    REVISE,
    REJECT
}
