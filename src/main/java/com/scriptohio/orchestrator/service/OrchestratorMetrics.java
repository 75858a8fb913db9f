package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class OrchestratorMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter requestsSucceeded;
    private final Counter requestsFailed;
    private final Counter requestsRejected;
    private final Timer requestDuration;
    private final Counter contextCacheHits;
    private final Counter contextCacheMisses;

    public OrchestratorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.requestsSucceeded = Counter.builder("orchestrator.requests")
                .tag("outcome", "success")
                .description("Requests answered successfully")
                .register(meterRegistry);
        this.requestsFailed = Counter.builder("orchestrator.requests")
                .tag("outcome", "failure")
                .description("Requests whose subtasks all failed")
                .register(meterRegistry);
        this.requestsRejected = Counter.builder("orchestrator.requests")
                .tag("outcome", "rejected")
                .description("Requests rejected before routing")
                .register(meterRegistry);
        this.requestDuration = Timer.builder("orchestrator.requests.duration")
                .description("End-to-end request latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
        this.contextCacheHits = Counter.builder("orchestrator.context.cache")
                .tag("result", "hit")
                .register(meterRegistry);
        this.contextCacheMisses = Counter.builder("orchestrator.context.cache")
                .tag("result", "miss")
                .register(meterRegistry);
    }

    public void recordRequest(boolean success, Duration duration) {
        (success ? requestsSucceeded : requestsFailed).increment();
        requestDuration.record(duration);
    }

    public void recordRejected() {
        requestsRejected.increment();
    }

    public void recordSubtask(String agentType, String agentId, ErrorKind failure, Duration duration) {
        String outcome = failure == null ? "success" : failure.name().toLowerCase();
        meterRegistry.counter("orchestrator.subtasks",
                "agent_type", nullSafe(agentType), "agent_id", nullSafe(agentId), "outcome", outcome)
            .increment();
        meterRegistry.timer("orchestrator.subtasks.duration",
                "agent_type", nullSafe(agentType), "agent_id", nullSafe(agentId))
            .record(duration);
    }

    public void recordReview(String status) {
        meterRegistry.counter("orchestrator.reviews", "status", status.toLowerCase()).increment();
    }

    public void recordContextCache(boolean hit) {
        (hit ? contextCacheHits : contextCacheMisses).increment();
    }

    private static String nullSafe(String value) {
        return value == null ? "none" : value;
    }
}
