package com.scriptohio.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// cached and shared between callers, so lists are immutable
@Value
@Builder(toBuilder = true)
public class OptimizedContext {
    String role;
    String dataScope;
    long budgetTokens;
    long originalTokens;
    long estimatedTokens;
    boolean truncated;
    String contentHash;

    @Builder.Default
    List<ContextResource> resources = List.of();

    @Builder.Default
    List<String> droppedFocusAreas = List.of();

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("role", role);
        map.put("data_scope", dataScope);
        map.put("budget_tokens", budgetTokens);
        map.put("estimated_tokens", estimatedTokens);
        map.put("truncated", truncated);
        map.put("resources", resources.stream().map(ContextResource::getId).toList());
        map.put("dropped_focus_areas", List.copyOf(droppedFocusAreas));
        return map;
    }
}
