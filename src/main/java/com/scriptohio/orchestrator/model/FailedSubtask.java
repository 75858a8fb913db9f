package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailedSubtask {
    private String subtaskId;
    private String agentType;
    private String action;
    private ErrorKind errorKind;
    private String error;
    // RATE_LIMITED, UNAUTHORIZED, NOT_FOUND or TRANSPORT when a data source failed
    private String sourceError;

    public String describe() {
        return String.format("%s (%s): %s - %s", subtaskId, action, errorKind, error);
    }
}
