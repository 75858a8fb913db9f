package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.agent.AgentUnavailableException;
import com.scriptohio.orchestrator.client.DataSourceException;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.SubTask;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubtaskExecutorTest {

    @Mock
    private RequestRouter router;

    private ExecutorService workers;
    private SubtaskExecutor executor;

    @BeforeEach
    void setUp() {
        workers = Executors.newFixedThreadPool(4);
        executor = new SubtaskExecutor(workers, router, new OrchestratorMetrics(new SimpleMeterRegistry()),
            Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        workers.shutdownNow();
    }

    private static AgentHandle handle(String id, int maxConcurrent, Object payload) {
        StubAgent agent = StubAgent.returning(
            StubAgent.descriptor("data", id, PermissionLevel.READ_EXECUTE,
                    StubAgent.capability("fetch_games", PermissionLevel.READ_EXECUTE))
                .toBuilder().maxConcurrentTasks(maxConcurrent).build(),
            payload, 0.9);
        return new AgentHandle(agent.getDescriptor(), agent);
    }

    private static SubTask subtask(String id, String... dependsOn) {
        return SubTask.builder().id(id).action("fetch_games").dependsOn(new ArrayList<>(List.of(dependsOn))).build();
    }

    @Test
    void shouldRetryOnAlternateWhenPrimaryIsSaturated() {
        AgentHandle saturated = handle("data-1", 1, "from data-1");
        AgentHandle spare = handle("data-2", 1, "from data-2");
        assertTrue(saturated.tryAcquire());
        when(router.route(isNull(), eq("fetch_games"), eq(PermissionLevel.READ_EXECUTE)))
            .thenReturn(new RoutingDecision("fetch_games", List.of(saturated, spare)));

        Map<String, SubtaskOutcome> outcomes = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.READ_EXECUTE, Map.of(), Map.of(), new ExecutionControl("req-1"));

        SubtaskOutcome outcome = outcomes.get("games");
        assertTrue(outcome.isSuccess());
        assertEquals("data-2", outcome.getAgentId());
        assertEquals("from data-2", outcome.payload());
        assertEquals(1, saturated.load());
    }

    private static AgentHandle failing(String id, StubAgent.Behaviour behaviour) {
        StubAgent agent = new StubAgent(
            StubAgent.descriptor("data", id, PermissionLevel.READ_EXECUTE,
                StubAgent.capability("fetch_games", PermissionLevel.READ_EXECUTE)),
            behaviour);
        return new AgentHandle(agent.getDescriptor(), agent);
    }

    @Test
    void shouldRetryOnAlternateWhenAgentReportsItselfUnavailable() {
        AgentHandle broken = failing("data-a", (action, parameters, invocation) -> {
            throw new AgentUnavailableException("model file missing");
        });
        AgentHandle healthy = handle("data-b", 1, "from data-b");
        when(router.route(any(), any(), any()))
            .thenReturn(new RoutingDecision("fetch_games", List.of(broken, healthy)));

        SubtaskOutcome outcome = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.READ_EXECUTE, Map.of(), Map.of(), new ExecutionControl("req-5")).get("games");

        assertTrue(outcome.isSuccess());
        assertEquals("data-b", outcome.getAgentId());
        assertEquals("from data-b", outcome.payload());
    }

    @Test
    void shouldReportAgentUnavailableThrownDuringExecution() {
        AgentHandle broken = failing("data-a", (action, parameters, invocation) -> {
            throw new AgentUnavailableException("model file missing");
        });
        when(router.route(any(), any(), any()))
            .thenReturn(new RoutingDecision("fetch_games", List.of(broken)));

        SubtaskOutcome outcome = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.READ_EXECUTE, Map.of(), Map.of(), new ExecutionControl("req-6")).get("games");

        assertEquals(ErrorKind.AGENT_UNAVAILABLE, outcome.getErrorKind());
        assertEquals("model file missing", outcome.getError());
    }

    @Test
    void shouldKeepDataSourceErrorKind() {
        AgentHandle throttled = failing("data-a", (action, parameters, invocation) -> {
            throw new DataSourceException(DataSourceException.Kind.RATE_LIMITED, "429 from /games");
        });
        when(router.route(any(), any(), any()))
            .thenReturn(new RoutingDecision("fetch_games", List.of(throttled)));

        SubtaskOutcome outcome = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.READ_EXECUTE, Map.of(), Map.of(), new ExecutionControl("req-7")).get("games");

        assertEquals(ErrorKind.INTERNAL_AGENT_ERROR, outcome.getErrorKind());
        assertEquals(DataSourceException.Kind.RATE_LIMITED, outcome.getSourceError());
        assertEquals("RATE_LIMITED", outcome.toFailure().getSourceError());
    }

    @Test
    void shouldReportUnavailableWhenNoAlternateRemains() {
        AgentHandle saturated = handle("data-1", 1, "unused");
        assertTrue(saturated.tryAcquire());
        when(router.route(any(), any(), any()))
            .thenReturn(new RoutingDecision("fetch_games", List.of(saturated)));

        SubtaskOutcome outcome = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.READ_EXECUTE, Map.of(), Map.of(), new ExecutionControl("req-2")).get("games");

        assertEquals(ErrorKind.AGENT_UNAVAILABLE, outcome.getErrorKind());
    }

    @Test
    void shouldTurnRoutingFailureIntoOutcome() {
        when(router.route(any(), any(), any()))
            .thenThrow(new RoutingException(ErrorKind.CAPABILITY_MISMATCH, "No agent exposes action 'fetch_games'"));

        Map<String, SubtaskOutcome> outcomes = executor.executeAll(List.of(subtask("a"), subtask("b", "a")),
            PermissionLevel.ADMIN, Map.of(), null, new ExecutionControl("req-3"));

        assertEquals(ErrorKind.CAPABILITY_MISMATCH, outcomes.get("a").getErrorKind());
        assertEquals(ErrorKind.DEPENDENCY_FAILED, outcomes.get("b").getErrorKind());
        verify(router, times(1)).route(any(), any(), any());
    }

    @Test
    void shouldNotStartSubtasksOfCancelledRequest() {
        ExecutionControl control = new ExecutionControl("req-4");
        assertTrue(control.cancel());

        SubtaskOutcome outcome = executor.executeAll(List.of(subtask("games")),
            PermissionLevel.ADMIN, Map.of(), Map.of(), control).get("games");

        assertEquals(ErrorKind.CANCELLED, outcome.getErrorKind());
        verifyNoInteractions(router);
    }

    @Test
    void shouldOrderDependenciesFirst() {
        List<SubTask> ordered = SubtaskExecutor.topologicalOrder(
            List.of(subtask("c", "b"), subtask("b", "a"), subtask("a")));

        assertEquals(List.of("a", "b", "c"), ordered.stream().map(SubTask::getId).toList());
    }

    @Test
    void shouldRejectCyclesAndUnknownDependencies() {
        assertThrows(IllegalArgumentException.class,
            () -> SubtaskExecutor.topologicalOrder(List.of(subtask("a", "b"), subtask("b", "a"))));
        assertThrows(IllegalArgumentException.class,
            () -> SubtaskExecutor.topologicalOrder(List.of(subtask("a", "missing"))));
    }
}
