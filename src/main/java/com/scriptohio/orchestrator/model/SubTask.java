package com.scriptohio.orchestrator.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class SubTask {
    @NotBlank
    private String id;

    private String agentType;

    @NotBlank
    private String action;

    @NotNull
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @NotNull
    @Builder.Default
    private List<@NotBlank String> dependsOn = new ArrayList<>();

    // overrides orchestrator.subtask-timeout when set
    private Long timeoutMillis;

    private boolean peerReview;
}
