package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentResult;
import com.scriptohio.orchestrator.agent.AgentTypes;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.AgentRequest;
import com.scriptohio.orchestrator.model.AgentResponse;
import com.scriptohio.orchestrator.model.ContextResource;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.FailedSubtask;
import com.scriptohio.orchestrator.model.KnowledgeItem;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.ResourceKind;
import com.scriptohio.orchestrator.model.ReviewDecision;
import com.scriptohio.orchestrator.model.ReviewVerdict;
import com.scriptohio.orchestrator.model.SubTask;
import com.scriptohio.orchestrator.store.JsonlKnowledgeStore;
import com.scriptohio.orchestrator.store.JsonlSessionSummaryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorServiceTest {

    @TempDir
    Path tempDir;

    private ExecutorService workers;
    private SubtaskExecutor executor;
    private ConversationMemory memory;
    private CollaborationManager collaboration;
    private OrchestratorService service;

    private StubAgent predictionAgent;
    private StubAgent analysisAgent;
    private StubAgent slowAgent;
    private final AtomicReference<ReviewVerdict> verdict = new AtomicReference<>(ReviewVerdict.APPROVE);

    @BeforeEach
    void setUp() throws Exception {
        workers = Executors.newFixedThreadPool(8);
        Clock clock = Clock.systemUTC();
        OrchestratorMetrics metrics = new OrchestratorMetrics(new SimpleMeterRegistry());

        predictionAgent = StubAgent.returning(
            StubAgent.descriptor("prediction", "prediction-1", PermissionLevel.ADMIN,
                StubAgent.capability("predict_outcome", PermissionLevel.ADMIN)),
            Map.of("margin", 3.5), 0.7);
        StubAgent dataAgent = StubAgent.returning(
            StubAgent.descriptor("data", "data-1", PermissionLevel.READ_EXECUTE,
                StubAgent.capability("fetch_games", PermissionLevel.READ_EXECUTE)),
            List.of(Map.of("home_team", "Ohio State", "away_team", "Texas")), 0.9);
        analysisAgent = new StubAgent(
            StubAgent.descriptor("analysis", "analysis-1", PermissionLevel.READ_EXECUTE_WRITE,
                StubAgent.capability("generate_analysis", PermissionLevel.READ_EXECUTE)),
            (action, parameters, invocation) -> AgentResult.builder()
                .payload(parameters.get(SubtaskExecutor.UPSTREAM))
                .confidence(0.8)
                .insights(List.of("Key finding: home teams covered 56% of spreads"))
                .domainTags(List.of("rankings"))
                .build());
        slowAgent = new StubAgent(
            StubAgent.descriptor("slow", "slow-1", PermissionLevel.READ_EXECUTE,
                StubAgent.capability("slow_query", PermissionLevel.READ_EXECUTE)),
            (action, parameters, invocation) -> {
                Thread.sleep(10_000);
                return AgentResult.of("too late", 1.0);
            });
        StubAgent failingAgent = new StubAgent(
            StubAgent.descriptor("failing", "failing-1", PermissionLevel.READ_EXECUTE,
                StubAgent.capability("explode", PermissionLevel.READ_EXECUTE)),
            (action, parameters, invocation) -> {
                throw new IllegalStateException("model file corrupt");
            });
        StubAgent reviewer = new StubAgent(
            StubAgent.descriptor("qa", "qa-1", PermissionLevel.READ_EXECUTE,
                StubAgent.capability(AgentTypes.PEER_REVIEW, PermissionLevel.READ_EXECUTE)),
            (action, parameters, invocation) -> AgentResult.of(ReviewDecision.of("qa-1", verdict.get(), "checked")));

        CapabilityRegistry registry = new CapabilityRegistry();
        for (StubAgent agent : List.of(predictionAgent, dataAgent, analysisAgent, slowAgent, failingAgent, reviewer)) {
            registry.register(agent.getDescriptor().getAgentType(), id -> agent);
            registry.create(agent.getDescriptor().getAgentType(), agent.getDescriptor().getAgentId());
        }
        registry.freeze();

        ContextProfileLoader loader = new ContextProfileLoader(new DefaultResourceLoader(), new OrchestratorProperties());
        loader.load();
        ContextOptimizer optimizer = new ContextOptimizer(loader, 10_000, Duration.ofMinutes(5), 100, metrics);
        memory = new ConversationMemory(new JsonlSessionSummaryStore(tempDir), clock, 10, 5, Duration.ofMinutes(30));
        executor = new SubtaskExecutor(workers, new RequestRouter(registry), metrics, Duration.ofSeconds(5));
        collaboration = new CollaborationManager(registry, new JsonlKnowledgeStore(tempDir), workers, clock,
            1, Duration.ofSeconds(2), metrics);

        service = new OrchestratorService(Validation.buildDefaultValidatorFactory().getValidator(),
            new RoleDetector(), optimizer, memory, new RequestPlanner(), executor, collaboration,
            new ResponseSynthesizer(), metrics, clock, new OrchestratorProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        workers.shutdownNow();
    }

    private static Map<String, Object> user(String userId, String role) {
        Map<String, Object> context = new HashMap<>();
        context.put(AgentRequest.USER_ID, userId);
        context.put(AgentRequest.ROLE, role);
        return context;
    }

    private static SubTask subtask(String id, String action, String... dependsOn) {
        return SubTask.builder().id(id).action(action).dependsOn(new ArrayList<>(List.of(dependsOn))).build();
    }

    @Test
    void shouldDenyActionAboveCallerPermissionWithoutInvokingAgent() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-1")
            .agentType("prediction")
            .action("predict_outcome")
            .userContext(user("user-1", RoleDetector.PRODUCTION))
            .build());

        assertFalse(response.isSuccess());
        assertEquals(ErrorKind.PERMISSION_DENIED, response.getErrorKind());
        assertEquals(0, predictionAgent.invocations.get());
    }

    @Test
    void shouldHonourExplicitPermissionFromUserContext() {
        Map<String, Object> caller = user("user-1", RoleDetector.ANALYST);
        caller.put(AgentRequest.PERMISSION, "READ_ONLY");

        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-1b")
            .action("fetch_games")
            .userContext(caller)
            .build());

        assertEquals(ErrorKind.PERMISSION_DENIED, response.getErrorKind());
    }

    @Test
    void shouldReturnPartialSuccessWhenOneSubtaskTimesOut() {
        SubTask slow = subtask("slow", "slow_query").toBuilder().timeoutMillis(10L).build();

        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-2")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("games", "fetch_games"), slow))
            .build());

        assertTrue(response.isSuccess());
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) response.getResult();
        assertTrue(result.containsKey("games"));
        assertFalse(result.containsKey("slow"));
        assertEquals(1, response.getFailedSubtasks().size());
        FailedSubtask failure = response.getFailedSubtasks().get(0);
        assertEquals("slow", failure.getSubtaskId());
        assertEquals(ErrorKind.TIMEOUT, failure.getErrorKind());
        assertTrue(response.getDurationMillis() < 5_000);
    }

    @Test
    void shouldFailWithFirstErrorKindWhenAllSubtasksFail() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-3")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("boom", "explode"), subtask("after", "generate_analysis", "boom")))
            .build());

        assertFalse(response.isSuccess());
        assertEquals(ErrorKind.INTERNAL_AGENT_ERROR, response.getErrorKind());
        assertTrue(response.getError().startsWith("All subtasks failed: "));
        assertEquals(ErrorKind.DEPENDENCY_FAILED, response.getFailedSubtasks().get(1).getErrorKind());
        assertEquals(0, analysisAgent.invocations.get());
    }

    @Test
    void shouldPassUpstreamPayloadsToDependents() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-4")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("analyze", "generate_analysis", "games"), subtask("games", "fetch_games")))
            .build());

        assertTrue(response.isSuccess());
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) response.getResult();
        assertEquals(Map.of("games", result.get("games")), result.get("analyze"));
        assertEquals(List.of("analyze", "games"), new ArrayList<>(result.keySet()));
    }

    @Test
    void shouldRejectInvalidRequests() {
        AgentResponse noUser = service.submit(AgentRequest.builder()
            .requestId("req-5")
            .action("fetch_games")
            .build());
        AgentResponse cycle = service.submit(AgentRequest.builder()
            .requestId("req-6")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("a", "fetch_games", "b"), subtask("b", "fetch_games", "a")))
            .build());
        AgentResponse badTimeout = service.submit(AgentRequest.builder()
            .requestId("req-7")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("a", "fetch_games").toBuilder().timeoutMillis(0L).build()))
            .build());
        AgentResponse blankId = service.submit(AgentRequest.builder()
            .requestId(" ")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .action("fetch_games")
            .build());

        AgentResponse nullDependencies = service.submit(AgentRequest.builder()
            .requestId("req-7b")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("a", "fetch_games").toBuilder().dependsOn(null).build()))
            .build());
        AgentResponse nullEntry = service.submit(AgentRequest.builder()
            .requestId("req-7c")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(Arrays.asList(subtask("a", "fetch_games"), null))
            .build());

        for (AgentResponse response : List.of(noUser, cycle, badTimeout, blankId, nullDependencies, nullEntry)) {
            assertFalse(response.isSuccess());
            assertEquals(ErrorKind.VALIDATION_ERROR, response.getErrorKind());
            assertTrue(response.getError().startsWith("Invalid request: "));
        }
    }

    @Test
    void shouldReportRequestPriorityInMetadata() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-priority")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .action("fetch_games")
            .priority(7)
            .build());

        assertTrue(response.isSuccess());
        assertEquals(7, response.getMetadata().get("priority"));
    }

    @Test
    void shouldRejectDuplicateRequestId() {
        AgentRequest request = AgentRequest.builder()
            .requestId("req-8")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .action("fetch_games")
            .build();

        assertTrue(service.submit(request).isSuccess());
        AgentResponse again = service.submit(request);

        assertEquals(ErrorKind.VALIDATION_ERROR, again.getErrorKind());
        assertTrue(again.getError().contains("duplicate request id req-8"));
    }

    @Test
    void shouldReportConflictForEquallyRankedResults() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-9")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(subtask("week-1", "fetch_games"), subtask("week-2", "fetch_games")))
            .build());

        assertTrue(response.isSuccess());
        assertTrue(response.isConflicted());
        assertEquals("fetch_games", response.getConflicts().get(0).getAction());
        assertEquals(2, response.getConflicts().get(0).getResults().size());
    }

    @Test
    void shouldPeerReviewFlaggedSubtasks() {
        verdict.set(ReviewVerdict.REJECT);
        SubTask games = subtask("games", "fetch_games").toBuilder().peerReview(true).build();

        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-10")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .subtasks(List.of(games))
            .build());

        assertTrue(response.isSuccess());
        assertTrue(response.isConflicted());
        assertTrue(response.getConflicts().get(0).getReason().startsWith("peer review: 0 of 1"));
        @SuppressWarnings("unchecked")
        Map<String, Map<String, Object>> reviews = (Map<String, Map<String, Object>>) response.getMetadata().get("reviews");
        assertEquals("CONFLICTED", reviews.get("games").get("status"));
    }

    @Test
    void shouldKeepContextWithinRoleBudget() {
        List<ContextResource> context = new ArrayList<>();
        for (String area : List.of("model_inference", "monitoring", "automated_analysis", "model_inference")) {
            context.add(ContextResource.builder()
                .id(area + "-" + context.size())
                .kind(ResourceKind.DOCUMENT)
                .focusArea(area)
                .content("y".repeat(10_000))
                .build());
        }

        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-11")
            .userContext(user("user-1", RoleDetector.PRODUCTION))
            .action("fetch_games")
            .context(context)
            .build());

        assertTrue(response.isSuccess());
        assertEquals(RoleDetector.PRODUCTION, response.getMetadata().get("role"));
        assertEquals("READ_EXECUTE", response.getMetadata().get("permission"));
        assertTrue((Long) response.getMetadata().get("context_tokens") <= 2_500);
        assertEquals(true, response.getMetadata().get("context_truncated"));
    }

    @Test
    void shouldRecordTurnAndPublishInsights() {
        AgentResponse response = service.submit(AgentRequest.builder()
            .requestId("req-12")
            .query("Compare last week's games")
            .userContext(user("user-1", RoleDetector.ANALYST))
            .build());

        assertTrue(response.isSuccess());
        assertEquals(1, memory.recentTurns("user-1").size());
        assertEquals(response.getMetadata().get("session_id"), memory.activeSession("user-1").orElseThrow());

        List<KnowledgeItem> insights = collaboration.searchKnowledge("rankings", 0.0);
        assertEquals(1, insights.size());
        assertEquals("analysis/generate_analysis", insights.get(0).getTopic());
        assertEquals("analysis-1", insights.get(0).getAgentId());

        assertEquals(1, service.endSession("user-1").orElseThrow().getTurnCount());
    }

    @Test
    void shouldCancelRunningRequest() throws Exception {
        CompletableFuture<AgentResponse> pending = CompletableFuture.supplyAsync(() -> service.submit(
            AgentRequest.builder()
                .requestId("req-13")
                .userContext(user("user-1", RoleDetector.ANALYST))
                .action("slow_query")
                .build()));

        long deadline = System.currentTimeMillis() + 3_000;
        while (slowAgent.invocations.get() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(service.cancel("req-13"));

        AgentResponse response = pending.get(3, TimeUnit.SECONDS);
        assertFalse(response.isSuccess());
        assertEquals(ErrorKind.CANCELLED, response.getErrorKind());
        assertFalse(service.cancel("req-13"));
    }
}
