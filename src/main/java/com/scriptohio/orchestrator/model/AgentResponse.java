package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {
    private String requestId;
    private boolean success;
    private Object result;
    private String error;
    private ErrorKind errorKind;
    private long durationMillis;
    private String agentId;
    private Double confidence;

    @Builder.Default
    private List<FailedSubtask> failedSubtasks = new ArrayList<>();

    private boolean conflicted;

    @Builder.Default
    private List<ResultConflict> conflicts = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static AgentResponse failure(String requestId, ErrorKind kind, String error, long durationMillis) {
        return AgentResponse.builder()
            .requestId(requestId)
            .success(false)
            .errorKind(kind)
            .error(error)
            .durationMillis(durationMillis)
            .build();
    }
}
