package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentResult;
import com.scriptohio.orchestrator.client.DataSourceException;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.FailedSubtask;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.SubTask;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SubtaskOutcome {
    SubTask subtask;
    String agentId;
    String agentType;
    PermissionLevel agentPermission;
    AgentResult result;
    ErrorKind errorKind;
    String error;
    // set when the failure came from an external data source
    DataSourceException.Kind sourceError;
    long durationMillis;

    public boolean isSuccess() {
        return errorKind == null;
    }

    public Double confidence() {
        return result == null ? null : result.getConfidence();
    }

    public Object payload() {
        return result == null ? null : result.getPayload();
    }

    public FailedSubtask toFailure() {
        return FailedSubtask.builder()
            .subtaskId(subtask.getId())
            .agentType(agentType != null ? agentType : subtask.getAgentType())
            .action(subtask.getAction())
            .errorKind(errorKind)
            .error(error)
            .sourceError(sourceError == null ? null : sourceError.name())
            .build();
    }

    static SubtaskOutcome failed(SubTask subtask, ErrorKind kind, String error) {
        return SubtaskOutcome.builder().subtask(subtask).errorKind(kind).error(error).build();
    }
}
