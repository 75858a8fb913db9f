package com.scriptohio.orchestrator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.AgentRequest;
import com.scriptohio.orchestrator.model.AgentResponse;
import com.scriptohio.orchestrator.model.CollaborationTask;
import com.scriptohio.orchestrator.model.ConversationTurn;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.KnowledgeItem;
import com.scriptohio.orchestrator.model.OptimizedContext;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.SessionSummary;
import com.scriptohio.orchestrator.model.SubTask;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for analytics requests.
 * <p>
 * A request is validated, given a role and an optimized context, enriched
 * with the user's conversation memory, planned into subtasks and executed.
 * Results that ask for it go through peer review before they are merged. The
 * turn is then recorded in memory. Nothing thrown by an agent escapes
 * {@link #submit}.
 */
@Slf4j
@Service
public class OrchestratorService {

    static final String INSIGHT = "insight";

    private final Validator validator;
    private final RoleDetector roleDetector;
    private final ContextOptimizer contextOptimizer;
    private final ConversationMemory memory;
    private final RequestPlanner planner;
    private final SubtaskExecutor executor;
    private final CollaborationManager collaboration;
    private final ResponseSynthesizer synthesizer;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    private final Cache<String, Boolean> seenRequestIds;
    private final Map<String, ExecutionControl> running = new ConcurrentHashMap<>();

    public OrchestratorService(Validator validator, RoleDetector roleDetector, ContextOptimizer contextOptimizer,
                               ConversationMemory memory, RequestPlanner planner, SubtaskExecutor executor,
                               CollaborationManager collaboration, ResponseSynthesizer synthesizer,
                               OrchestratorMetrics metrics, Clock clock, OrchestratorProperties properties) {
        this.validator = validator;
        this.roleDetector = roleDetector;
        this.contextOptimizer = contextOptimizer;
        this.memory = memory;
        this.planner = planner;
        this.executor = executor;
        this.collaboration = collaboration;
        this.synthesizer = synthesizer;
        this.metrics = metrics;
        this.clock = clock;
        this.seenRequestIds = Caffeine.newBuilder()
                .maximumSize(properties.getRequestIdMemory())
                .build();
    }

    public AgentResponse submit(AgentRequest request) {
        long start = System.nanoTime();
        String requestId = request == null ? null : request.getRequestId();

        List<String> problems;
        try {
            problems = request == null ? List.of("request is required") : validate(request);
        } catch (RuntimeException e) {
            log.warn("Request {} could not be validated", requestId, e);
            problems = List.of("malformed request: " + e.getMessage());
        }
        if (problems.isEmpty() && seenRequestIds.asMap().putIfAbsent(requestId, Boolean.TRUE) != null) {
            problems = List.of("duplicate request id " + requestId);
        }
        if (!problems.isEmpty()) {
            log.warn("Rejected request {}: {}", requestId, problems);
            metrics.recordRejected();
            return AgentResponse.failure(requestId, ErrorKind.VALIDATION_ERROR,
                "Invalid request: " + String.join("; ", problems), elapsed(start));
        }

        ExecutionControl control = new ExecutionControl(requestId);
        running.put(requestId, control);
        try {
            return process(request, control, start);
        } catch (RuntimeException e) {
            log.error("Request {} failed unexpectedly", requestId, e);
            AgentResponse failure = AgentResponse.failure(requestId, ErrorKind.INTERNAL_AGENT_ERROR,
                e.getClass().getSimpleName() + ": " + e.getMessage(), elapsed(start));
            metrics.recordRequest(false, Duration.ofMillis(failure.getDurationMillis()));
            return failure;
        } finally {
            running.remove(requestId);
        }
    }

    public boolean cancel(String requestId) {
        ExecutionControl control = running.get(requestId);
        if (control == null) {
            return false;
        }
        log.info("Cancelling request {}", requestId);
        return control.cancel();
    }

    public Optional<SessionSummary> endSession(String userId) {
        return memory.endSession(userId);
    }

    private AgentResponse process(AgentRequest request, ExecutionControl control, long start) {
        String userId = request.getUserId();
        String role = roleDetector.detectRole(request.getUserContext(), request.getQuery());
        PermissionLevel permission = roleDetector.permissionFor(role, request.getUserContext());

        OptimizedContext optimized = contextOptimizer.load(role, request.getContext());
        Map<String, Object> context = memory.enhanceContext(userId, optimized.toMap(), request.getQuery());

        List<SubTask> plan = planner.plan(request);
        log.info("Request {} from {} as {} ({}), priority {}: {} subtasks", request.getRequestId(), userId, role,
            permission, request.getPriority(), plan.size());

        Map<String, SubtaskOutcome> outcomes = executor.executeAll(plan, permission, request.getUserContext(),
            context, control);

        Map<String, CollaborationTask> reviews = new LinkedHashMap<>();
        for (SubtaskOutcome outcome : outcomes.values()) {
            if (outcome.isSuccess() && !control.isCancelled() && wantsReview(outcome)) {
                reviews.put(outcome.getSubtask().getId(),
                    collaboration.initiatePeerReview(outcome.getAgentId(), outcome.payload()));
            }
        }

        AgentResponse response = synthesizer.synthesize(request.getRequestId(), outcomes, reviews, elapsed(start));
        response.getMetadata().put("role", role);
        response.getMetadata().put("permission", permission.name());
        response.getMetadata().put("priority", request.getPriority());
        response.getMetadata().put("context_tokens", optimized.getEstimatedTokens());
        response.getMetadata().put("context_truncated", optimized.isTruncated());

        publishInsights(outcomes);
        String sessionId = recordTurn(request, response, context, optimized, role);
        if (sessionId != null) {
            response.getMetadata().put("session_id", sessionId);
        }

        metrics.recordRequest(response.isSuccess(), Duration.ofMillis(response.getDurationMillis()));
        if (response.isSuccess() && !response.getFailedSubtasks().isEmpty()) {
            log.warn("Request {} partially failed: {}", request.getRequestId(), response.getFailedSubtasks());
        }
        return response;
    }

    List<String> validate(AgentRequest request) {
        List<String> problems = new ArrayList<>();
        for (ConstraintViolation<AgentRequest> violation : validator.validate(request)) {
            problems.add(violation.getPropertyPath() + " " + violation.getMessage());
        }
        String userId = request.getUserId();
        if (userId == null || userId.isBlank()) {
            problems.add("user_context." + AgentRequest.USER_ID + " is required");
        }

        List<SubTask> subtasks = request.getSubtasks() == null ? List.of() : request.getSubtasks();
        Set<String> ids = new HashSet<>();
        for (SubTask subtask : subtasks) {
            if (subtask == null) {
                problems.add("subtasks must not contain null entries");
                continue;
            }
            if (subtask.getDependsOn() == null || subtask.getDependsOn().contains(null)) {
                problems.add("subtask " + subtask.getId() + " depends_on must be a list of ids");
            }
            if (subtask.getParameters() == null) {
                problems.add("subtask " + subtask.getId() + " parameters must not be null");
            }
            if (subtask.getId() != null && !ids.add(subtask.getId())) {
                problems.add("duplicate subtask id " + subtask.getId());
            }
            if (subtask.getTimeoutMillis() != null && subtask.getTimeoutMillis() <= 0) {
                problems.add("subtask " + subtask.getId() + " timeout must be positive");
            }
        }
        if (problems.isEmpty() && !subtasks.isEmpty()) {
            try {
                SubtaskExecutor.topologicalOrder(subtasks);
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
        return problems;
    }

    private static boolean wantsReview(SubtaskOutcome outcome) {
        return outcome.getSubtask().isPeerReview()
            || (outcome.getResult() != null && outcome.getResult().isRequestsPeerReview());
    }

    private void publishInsights(Map<String, SubtaskOutcome> outcomes) {
        for (SubtaskOutcome outcome : outcomes.values()) {
            if (!outcome.isSuccess() || outcome.getResult().getInsights() == null) {
                continue;
            }
            for (String insight : outcome.getResult().getInsights()) {
                Double confidence = outcome.confidence();
                try {
                    collaboration.publishKnowledge(KnowledgeItem.builder()
                        .agentId(outcome.getAgentId())
                        .type(INSIGHT)
                        .topic(outcome.getAgentType() + "/" + outcome.getSubtask().getAction())
                        .description(insight)
                        .confidence(confidence == null ? 0.5 : Math.max(0, Math.min(1, confidence)))
                        .domainTags(outcome.getResult().getDomainTags())
                        .build());
                } catch (IllegalArgumentException e) {
                    log.warn("Insight from {} not published: {}", outcome.getAgentId(), e.getMessage());
                }
            }
        }
    }

    private String recordTurn(AgentRequest request, AgentResponse response, Map<String, Object> context,
                              OptimizedContext optimized, String role) {
        String query = request.getQuery() != null ? request.getQuery() : request.getAction();
        String text = response.isSuccess() ? String.valueOf(response.getResult()) : response.getError();
        ConversationTurn turn = ConversationTurn.builder()
            .query(query)
            .response(text)
            .contextSnapshot(context)
            .tokensUsed(optimized.getEstimatedTokens() + TokenEstimator.estimate(text))
            .detectedRole(role)
            .topic(TopicExtractor.mainTopic(query))
            .success(response.isSuccess())
            .timestamp(clock.instant())
            .build();
        try {
            return memory.addTurn(request.getUserId(), turn);
        } catch (RuntimeException e) {
            log.warn("Could not record turn for request {}: {}", request.getRequestId(), e.getMessage());
            return null;
        }
    }

    private static long elapsed(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
