package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;

import java.util.Map;

/**
 * Contract every agent implements. Implementations are invoked from worker
 * threads and must be safe for concurrent use up to the descriptor's
 * concurrency limit.
 */
public interface AnalyticsAgent {

    AgentDescriptor getDescriptor();

    AgentResult execute(String action, Map<String, Object> parameters, AgentInvocation invocation)
        throws Exception;
}
