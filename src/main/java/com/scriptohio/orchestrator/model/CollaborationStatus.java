package com.scriptohio.orchestrator.model;

public enum CollaborationStatus {
    PENDING,
    IN_REVIEW,
    RESOLVED,
    CONFLICTED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CONFLICTED;
    }

    public boolean canMoveTo(CollaborationStatus next) {
        return switch (this) {
            case PENDING -> next == IN_REVIEW || next == CONFLICTED;
            case IN_REVIEW -> next == RESOLVED || next == CONFLICTED;
            case RESOLVED, CONFLICTED -> false;
        };
    }
}
