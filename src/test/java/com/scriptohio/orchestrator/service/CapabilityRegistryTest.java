package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.agent.AgentUnavailableException;
import com.scriptohio.orchestrator.model.PermissionLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    private CapabilityRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CapabilityRegistry();
        registry.register("analysis", id -> StubAgent.returning(
            StubAgent.descriptor("analysis", id, PermissionLevel.READ_EXECUTE,
                StubAgent.capability("generate_analysis", PermissionLevel.READ_EXECUTE)), "ok", 0.9));
    }

    @Test
    void shouldCreateRegisteredAgent() throws Exception {
        AgentHandle handle = registry.create("analysis", "analysis-1");

        assertEquals("analysis-1", handle.getAgentId());
        assertEquals(1, registry.list().size());
        assertTrue(registry.handle("analysis-1").isPresent());
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("analysis", id -> null));
    }

    @Test
    void shouldSurfaceFactoryFailureAndKeepWorking() throws Exception {
        registry.register("broken", id -> {
            throw new IllegalStateException("model file missing");
        });

        AgentUnavailableException e = assertThrows(AgentUnavailableException.class,
            () -> registry.create("broken", "broken-1"));
        assertTrue(e.getMessage().contains("model file missing"));

        registry.create("analysis", "analysis-1");
        assertEquals(1, registry.handles().size());
    }

    @Test
    void shouldFailForUnknownType() {
        assertThrows(AgentUnavailableException.class, () -> registry.create("nope", "nope-1"));
    }

    @Test
    void shouldRejectDuplicateCapabilityNames() {
        registry.register("twice", id -> StubAgent.returning(
            StubAgent.descriptor("twice", id, PermissionLevel.ADMIN,
                StubAgent.capability("same", PermissionLevel.READ_ONLY),
                StubAgent.capability("same", PermissionLevel.READ_ONLY)), "x", 1.0));

        assertThrows(IllegalArgumentException.class, () -> registry.create("twice", "twice-1"));
        assertTrue(registry.handles().isEmpty());
    }

    @Test
    void shouldBeImmutableOnceFrozen() throws Exception {
        registry.create("analysis", "analysis-1");
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("late", id -> null));
        assertThrows(IllegalStateException.class, () -> registry.create("analysis", "analysis-2"));
        assertEquals(1, registry.list().size());
    }
}
