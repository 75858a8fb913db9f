package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummary {
    private String sessionId;
    private String userId;
    private Instant startedAt;
    private Instant endedAt;
    private String digest;
    private int turnCount;
    private long totalTokens;
    private String dominantRole;

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    // "succeeded" / "failed" -> count
    @Builder.Default
    private Map<String, Integer> outcomeTally = new LinkedHashMap<>();

    @Builder.Default
    private List<String> keyInsights = new ArrayList<>();
}
