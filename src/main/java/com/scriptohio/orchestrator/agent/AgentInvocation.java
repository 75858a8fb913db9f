package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.PermissionLevel;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

@Getter
public class AgentInvocation {
    private final String requestId;
    private final String subtaskId;
    private final Map<String, Object> userContext;
    private final PermissionLevel callerPermission;
    private final AtomicBoolean cancelled;

    public AgentInvocation(String requestId, String subtaskId, Map<String, Object> userContext,
                           PermissionLevel callerPermission, AtomicBoolean cancelled) {
        this.requestId = requestId;
        this.subtaskId = subtaskId;
        this.userContext = userContext == null ? Map.of() : Collections.unmodifiableMap(userContext);
        this.callerPermission = callerPermission;
        this.cancelled = cancelled;
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void checkCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Subtask " + subtaskId + " cancelled");
        }
    }
}
