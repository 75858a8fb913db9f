package com.scriptohio.orchestrator.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResult {
    private Object payload;
    private Double confidence;
    private boolean requestsPeerReview;

    // shared with other agents through the knowledge store
    @Builder.Default
    private List<String> insights = new ArrayList<>();

    @Builder.Default
    private List<String> domainTags = new ArrayList<>();

    public static AgentResult of(Object payload) {
        return AgentResult.builder().payload(payload).build();
    }

    public static AgentResult of(Object payload, double confidence) {
        return AgentResult.builder().payload(payload).confidence(confidence).build();
    }
}
