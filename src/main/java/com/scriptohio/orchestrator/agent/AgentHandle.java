package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

@Getter
public class AgentHandle {
    private final AgentDescriptor descriptor;
    private final AnalyticsAgent agent;
    private final AtomicInteger inFlight = new AtomicInteger();

    public AgentHandle(AgentDescriptor descriptor, AnalyticsAgent agent) {
        this.descriptor = descriptor;
        this.agent = agent;
    }

    public String getAgentId() {
        return descriptor.getAgentId();
    }

    public String getAgentType() {
        return descriptor.getAgentType();
    }

    public int load() {
        return inFlight.get();
    }

    public boolean hasCapacity() {
        return inFlight.get() < descriptor.getMaxConcurrentTasks();
    }

    public boolean tryAcquire() {
        while (true) {
            int current = inFlight.get();
            if (current >= descriptor.getMaxConcurrentTasks()) {
                return false;
            }
            if (inFlight.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        inFlight.updateAndGet(current -> Math.max(0, current - 1));
    }
}
