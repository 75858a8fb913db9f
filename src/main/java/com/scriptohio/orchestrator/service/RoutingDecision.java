package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import lombok.Value;

import java.util.List;

// candidates best first
@Value
public class RoutingDecision {
    String action;
    List<AgentHandle> candidates;

    public AgentHandle primary() {
        return candidates.get(0);
    }

    public List<AgentHandle> alternates() {
        return candidates.subList(1, candidates.size());
    }
}
