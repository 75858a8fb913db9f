package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.Capability;
import com.scriptohio.orchestrator.model.PermissionLevel;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public abstract class AbstractAnalyticsAgent implements AnalyticsAgent {

    @FunctionalInterface
    protected interface ActionHandler {
        AgentResult handle(Map<String, Object> parameters, AgentInvocation invocation) throws Exception;
    }

    private final AgentDescriptor descriptor;
    private final Map<String, ActionHandler> handlers = new HashMap<>();

    protected AbstractAnalyticsAgent(AgentDescriptor descriptor) {
        descriptor.validate();
        this.descriptor = descriptor;
    }

    protected void on(String action, ActionHandler handler) {
        if (!descriptor.hasCapability(action)) {
            throw new IllegalArgumentException("No capability declared for handler: " + action);
        }
        handlers.put(action, handler);
    }

    @Override
    public AgentDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public AgentResult execute(String action, Map<String, Object> parameters, AgentInvocation invocation)
        throws Exception {
        ActionHandler handler = handlers.get(action);
        if (handler == null) {
            throw new IllegalArgumentException(String.format(
                "Agent %s has no handler for action '%s'", descriptor.getAgentId(), action));
        }
        return handler.handle(parameters == null ? Map.of() : parameters, invocation);
    }

    protected static String stringParam(Map<String, Object> parameters, String key, String fallback) {
        Object value = parameters.get(key);
        return value == null ? fallback : value.toString();
    }

    protected static Integer intParam(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + key + "' is not an integer: " + value);
            }
        }
        return null;
    }

    protected static Capability capability(String name, String description,
                                           PermissionLevel required,
                                           long estimateMillis, List<String> dataAccess) {
        return Capability.builder()
            .name(name)
            .description(description)
            .requiredPermission(required)
            .estimatedExecutionMillis(estimateMillis)
            .dataAccess(dataAccess)
            .build();
    }
}
