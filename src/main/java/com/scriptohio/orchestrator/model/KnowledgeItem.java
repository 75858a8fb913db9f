package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeItem {
    private String knowledgeId;
    private String agentId;
    private String type;      // insight, pattern, method, data
    private String topic;
    private String description;
    private double confidence;

    @Builder.Default
    private List<String> domainTags = new ArrayList<>();

    private Instant publishedAt;

    // id of the earlier item on the same topic, if any
    private String supersedes;
}
