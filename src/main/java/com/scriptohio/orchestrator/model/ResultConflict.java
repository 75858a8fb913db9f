package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultConflict {
    private String action;
    private String reason;

    // subtask id -> result payload
    @Builder.Default
    private Map<String, Object> results = new LinkedHashMap<>();
}
