package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.model.Capability;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.PermissionLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Selects the agent instances that may run an action.
 * <p>
 * An instance qualifies when it exposes an available capability with the
 * action's name, both its own level and the caller's level permit the
 * capability, and it has spare capacity. Qualifying instances are ordered by
 * exact type match, current load, execution estimate and agent id.
 */
@Slf4j
@Component
public class RequestRouter {

    private final CapabilityRegistry registry;

    public RequestRouter(CapabilityRegistry registry) {
        this.registry = registry;
    }

    public RoutingDecision route(String agentType, String action, PermissionLevel callerPermission) {
        List<Candidate> exposing = new ArrayList<>();
        for (AgentHandle handle : registry.handles()) {
            Optional<Capability> capability = handle.getDescriptor().findCapability(action);
            capability.ifPresent(c -> exposing.add(new Candidate(handle, c, handle.load())));
        }
        if (exposing.isEmpty()) {
            throw new RoutingException(ErrorKind.CAPABILITY_MISMATCH,
                "No agent exposes action '" + action + "'");
        }

        List<Candidate> permitted = new ArrayList<>();
        for (Candidate candidate : exposing) {
            PermissionLevel required = candidate.capability.getRequiredPermission();
            if (PermissionLevel.permits(candidate.handle.getDescriptor().getPermissionLevel(), required)
                && PermissionLevel.permits(callerPermission, required)) {
                permitted.add(candidate);
            }
        }
        if (permitted.isEmpty()) {
            throw new RoutingException(ErrorKind.PERMISSION_DENIED, String.format(
                "Permission %s does not allow action '%s'", callerPermission, action));
        }

        List<Candidate> ready = new ArrayList<>();
        for (Candidate candidate : permitted) {
            if (candidate.capability.isAvailable()
                && candidate.load < candidate.handle.getDescriptor().getMaxConcurrentTasks()) {
                ready.add(candidate);
            }
        }
        if (ready.isEmpty()) {
            throw new RoutingException(ErrorKind.AGENT_UNAVAILABLE,
                "Every agent for action '" + action + "' is busy or unavailable");
        }

        ready.sort(ordering(agentType));
        List<AgentHandle> ordered = new ArrayList<>();
        ready.forEach(c -> ordered.add(c.handle));
        log.debug("Routed {} to {} candidates, primary {}", action, ordered.size(), ordered.get(0).getAgentId());
        return new RoutingDecision(action, List.copyOf(ordered));
    }

    private static Comparator<Candidate> ordering(String agentType) {
        Comparator<Candidate> typeMatch = Comparator.comparingInt(
            c -> agentType != null && agentType.equals(c.handle.getAgentType()) ? 0 : 1);
        return typeMatch
            .thenComparingInt((Candidate c) -> c.load)
            .thenComparingLong(c -> c.capability.getEstimatedExecutionMillis())
            .thenComparing(c -> c.handle.getAgentId());
    }

    // load is read once so the sort sees a consistent snapshot
    private static final class Candidate {
        private final AgentHandle handle;
        private final Capability capability;
        private final int load;

        private Candidate(AgentHandle handle, Capability capability, int load) {
            this.handle = handle;
            this.capability = capability;
            this.load = load;
        }
    }
}
