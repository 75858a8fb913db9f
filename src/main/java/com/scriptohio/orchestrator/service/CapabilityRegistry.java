package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentFactory;
import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.agent.AgentUnavailableException;
import com.scriptohio.orchestrator.agent.AnalyticsAgent;
import com.scriptohio.orchestrator.model.AgentDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

// immutable after freeze(); request threads read it without locking
@Slf4j
public class CapabilityRegistry {

    private final Map<String, AgentFactory> factories = new LinkedHashMap<>();
    private volatile Map<String, AgentHandle> instances = Map.of();
    private volatile boolean frozen;

    public synchronized void register(String agentType, AgentFactory factory) {
        requireOpen();
        if (agentType == null || agentType.isBlank() || factory == null) {
            throw new IllegalArgumentException("Agent type and factory are required");
        }
        if (factories.containsKey(agentType)) {
            throw new IllegalArgumentException("Agent type already registered: " + agentType);
        }
        factories.put(agentType, factory);
    }

    public synchronized AgentHandle create(String agentType, String agentId) throws AgentUnavailableException {
        requireOpen();
        AgentFactory factory = factories.get(agentType);
        if (factory == null) {
            throw new AgentUnavailableException("Unknown agent type: " + agentType);
        }
        if (instances.containsKey(agentId)) {
            throw new IllegalArgumentException("Agent id already in use: " + agentId);
        }

        AnalyticsAgent agent;
        try {
            agent = factory.create(agentId);
        } catch (AgentUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AgentUnavailableException(
                String.format("Factory for %s failed to build %s: %s", agentType, agentId, e.getMessage()), e);
        }

        AgentDescriptor descriptor = agent.getDescriptor();
        descriptor.validate();
        if (!agentType.equals(descriptor.getAgentType()) || !agentId.equals(descriptor.getAgentId())) {
            throw new AgentUnavailableException(String.format(
                "Factory for %s returned %s/%s", agentType, descriptor.getAgentType(), descriptor.getAgentId()));
        }

        AgentHandle handle = new AgentHandle(descriptor, agent);
        Map<String, AgentHandle> next = new LinkedHashMap<>(instances);
        next.put(agentId, handle);
        instances = Collections.unmodifiableMap(next);
        log.info("Created agent {} of type {} with {} capabilities",
            agentId, agentType, descriptor.getCapabilities().size());
        return handle;
    }

    public synchronized void freeze() {
        frozen = true;
        log.info("Capability registry frozen with {} agent types and {} instances",
            factories.size(), instances.size());
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<AgentDescriptor> list() {
        List<AgentDescriptor> descriptors = new ArrayList<>();
        for (AgentHandle handle : instances.values()) {
            descriptors.add(handle.getDescriptor());
        }
        return descriptors;
    }

    public List<AgentHandle> handles() {
        return new ArrayList<>(instances.values());
    }

    public Optional<AgentHandle> handle(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(instances.get(agentId));
    }

    public synchronized Set<String> agentTypes() {
        return Set.copyOf(factories.keySet());
    }

    private void requireOpen() {
        if (frozen) {
            throw new IllegalStateException("Capability registry is frozen");
        }
    }
}
