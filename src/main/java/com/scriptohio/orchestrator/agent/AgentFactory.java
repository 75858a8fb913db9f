package com.scriptohio.orchestrator.agent;

@FunctionalInterface
public interface AgentFactory {

    AnalyticsAgent create(String agentId) throws AgentUnavailableException;
}
