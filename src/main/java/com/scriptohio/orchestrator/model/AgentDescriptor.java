package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentDescriptor {
    private String agentType;
    private String agentId;
    private String name;
    private PermissionLevel permissionLevel;

    @Builder.Default
    private List<Capability> capabilities = new ArrayList<>();

    @Builder.Default
    private List<String> expertiseDomains = new ArrayList<>();

    @Builder.Default
    private int maxConcurrentTasks = 3;

    public Optional<Capability> findCapability(String action) {
        if (action == null) {
            return Optional.empty();
        }
        return capabilities.stream()
            .filter(c -> action.equals(c.getName()))
            .findFirst();
    }

    public boolean hasCapability(String action) {
        return findCapability(action).isPresent();
    }

    public void validate() {
        Set<String> seen = new HashSet<>();
        for (Capability capability : capabilities) {
            if (!seen.add(capability.getName())) {
                throw new IllegalArgumentException(String.format(
                    "Duplicate capability '%s' on agent %s", capability.getName(), agentId));
            }
        }
    }
}
