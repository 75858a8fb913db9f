package com.scriptohio.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class ConversationTurn {
    String userId;
    String sessionId;
    String query;
    String response;
    Map<String, Object> contextSnapshot;
    long tokensUsed;
    String detectedRole;
    String topic;
    boolean success;
    Instant timestamp;
}
