package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.agent.AgentHandle;
import com.scriptohio.orchestrator.agent.AgentInvocation;
import com.scriptohio.orchestrator.agent.AgentResult;
import com.scriptohio.orchestrator.agent.AgentTypes;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.Capability;
import com.scriptohio.orchestrator.model.CollaborationStatus;
import com.scriptohio.orchestrator.model.CollaborationTask;
import com.scriptohio.orchestrator.model.KnowledgeItem;
import com.scriptohio.orchestrator.model.PermissionLevel;
import com.scriptohio.orchestrator.model.ReviewDecision;
import com.scriptohio.orchestrator.model.ReviewVerdict;
import com.scriptohio.orchestrator.store.KnowledgeStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared knowledge between agents, expert lookup and peer review.
 * <p>
 * Knowledge is append-only. A newer item on the same topic supersedes the
 * older one, which stays stored but drops out of search results.
 * <p>
 * A peer review asks up to the configured number of reviewers for a verdict
 * and resolves only when approvals are a strict majority of the reviewers
 * assigned. No reviewer, a timeout or a split vote leaves the task
 * CONFLICTED.
 */
@Slf4j
@Service
public class CollaborationManager {

    private final CapabilityRegistry registry;
    private final KnowledgeStore store;
    private final ExecutorService workers;
    private final Clock clock;
    private final int reviewers;
    private final Duration reviewTimeout;
    private final OrchestratorMetrics metrics;

    private final Map<String, TagIndex> byTag = new ConcurrentHashMap<>();
    private final Map<String, KnowledgeItem> currentByTopic = new ConcurrentHashMap<>();
    private final Set<String> superseded = ConcurrentHashMap.newKeySet();
    private final Map<String, CollaborationTask> tasks = new ConcurrentHashMap<>();

    @Autowired
    public CollaborationManager(CapabilityRegistry registry, KnowledgeStore store,
                                @Qualifier("orchestratorWorkers") ExecutorService workers, Clock clock,
                                OrchestratorProperties properties, OrchestratorMetrics metrics) {
        this(registry, store, workers, clock, properties.getCollaboration().getReviewers(),
            properties.getCollaboration().getReviewTimeout(), metrics);
    }

    public CollaborationManager(CapabilityRegistry registry, KnowledgeStore store, ExecutorService workers,
                                Clock clock, int reviewers, Duration reviewTimeout, OrchestratorMetrics metrics) {
        this.registry = registry;
        this.store = store;
        this.workers = workers;
        this.clock = clock;
        this.reviewers = Math.max(1, reviewers);
        this.reviewTimeout = reviewTimeout;
        this.metrics = metrics;
    }

    @PostConstruct
    public void replay() {
        List<KnowledgeItem> items;
        try {
            items = store.loadAll();
        } catch (IOException e) {
            log.warn("Could not replay knowledge store: {}", e.getMessage());
            return;
        }
        items.forEach(this::index);
        log.info("Replayed {} knowledge items across {} tags", items.size(), byTag.size());
    }

    public KnowledgeItem publishKnowledge(KnowledgeItem item) {
        if (item.getTopic() == null || item.getTopic().isBlank()) {
            throw new IllegalArgumentException("Knowledge item needs a topic");
        }
        if (item.getConfidence() < 0 || item.getConfidence() > 1) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + item.getConfidence());
        }

        KnowledgeItem[] stored = new KnowledgeItem[1];
        currentByTopic.compute(item.getTopic(), (topic, previous) -> {
            stored[0] = item.toBuilder()
                .knowledgeId(item.getKnowledgeId() != null ? item.getKnowledgeId() : UUID.randomUUID().toString())
                .publishedAt(item.getPublishedAt() != null ? item.getPublishedAt() : clock.instant())
                .domainTags(item.getDomainTags() == null ? new ArrayList<>() : new ArrayList<>(item.getDomainTags()))
                .supersedes(previous == null ? null : previous.getKnowledgeId())
                .build();
            if (previous != null) {
                superseded.add(previous.getKnowledgeId());
            }
            return stored[0];
        });
        KnowledgeItem published = stored[0];
        for (String tag : published.getDomainTags()) {
            byTag.computeIfAbsent(tag, t -> new TagIndex()).add(published);
        }

        try {
            store.append(published);
        } catch (IOException e) {
            log.warn("Failed to persist knowledge item {}: {}", published.getKnowledgeId(), e.getMessage());
        }
        log.debug("Agent {} published {} on {} (supersedes {})",
            published.getAgentId(), published.getKnowledgeId(), published.getTopic(), published.getSupersedes());
        return published;
    }

    public List<KnowledgeItem> searchKnowledge(String tag, double minConfidence) {
        TagIndex index = byTag.get(tag);
        if (index == null) {
            return List.of();
        }
        List<KnowledgeItem> matches = new ArrayList<>();
        for (KnowledgeItem item : index.snapshot()) {
            if (!superseded.contains(item.getKnowledgeId()) && item.getConfidence() >= minConfidence) {
                matches.add(item);
            }
        }
        matches.sort(Comparator.comparingDouble(KnowledgeItem::getConfidence).reversed()
            .thenComparing(KnowledgeItem::getPublishedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return matches;
    }

    public Optional<AgentHandle> findExpert(String capabilityOrTag, String excludeAgentId) {
        Set<String> excluded = new HashSet<>();
        if (excludeAgentId != null) {
            excluded.add(excludeAgentId);
        }
        return findExpert(capabilityOrTag, excluded, false);
    }

    public CollaborationTask initiatePeerReview(String initiatorAgentId, Object payload) {
        CollaborationTask task = new CollaborationTask(
            "review-" + UUID.randomUUID().toString().substring(0, 8), initiatorAgentId, payload, clock.instant());
        tasks.put(task.getTaskId(), task);

        Set<String> excluded = new HashSet<>();
        excluded.add(initiatorAgentId);
        List<AgentHandle> assigned = new ArrayList<>();
        for (int i = 0; i < reviewers; i++) {
            Optional<AgentHandle> reviewer = findExpert(AgentTypes.PEER_REVIEW, excluded, true);
            if (reviewer.isEmpty()) {
                break;
            }
            assigned.add(reviewer.get());
            excluded.add(reviewer.get().getAgentId());
        }

        if (assigned.isEmpty()) {
            task.conflict("no reviewer available");
            log.warn("No reviewer available for {} from {}", task.getTaskId(), initiatorAgentId);
            record(task);
            return task;
        }

        task.assignReviewers(assigned.stream().map(AgentHandle::getAgentId).toList());
        task.startReview();

        List<PendingReview> pending = new ArrayList<>();
        for (AgentHandle reviewer : assigned) {
            PendingReview review = sendReviewMessage(task, reviewer);
            if (review != null) {
                pending.add(review);
            }
        }

        long deadline = System.nanoTime() + reviewTimeout.toNanos();
        for (PendingReview review : pending) {
            String reviewerId = review.reviewer.getAgentId();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                AgentResult result = review.future.get(remaining, TimeUnit.NANOSECONDS);
                ReviewDecision decision = asDecision(reviewerId, result);
                if (decision != null) {
                    task.recordDecision(decision);
                }
            } catch (TimeoutException e) {
                review.abandon();
                log.warn("Reviewer {} timed out on {}", reviewerId, task.getTaskId());
            } catch (ExecutionException e) {
                log.warn("Reviewer {} failed on {}: {}", reviewerId, task.getTaskId(), e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(PendingReview::abandon);
                break;
            }
        }

        long approvals = task.count(ReviewVerdict.APPROVE);
        int assignedCount = task.getReviewerIds().size();
        String tally = String.format("%d of %d reviewers approved", approvals, assignedCount);
        if (approvals * 2 > assignedCount) {
            task.resolve(tally);
        } else {
            task.conflict(tally);
        }
        record(task);
        return task;
    }

    public Optional<CollaborationTask> task(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    private PendingReview sendReviewMessage(CollaborationTask task, AgentHandle reviewer) {
        if (!reviewer.tryAcquire()) {
            log.warn("Reviewer {} became saturated before {}", reviewer.getAgentId(), task.getTaskId());
            return null;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("payload", task.getPayload());
        message.put("initiator", task.getInitiatorAgentId());
        message.put("task_id", task.getTaskId());
        AgentInvocation invocation = new AgentInvocation(task.getTaskId(), reviewer.getAgentId(), Map.of(),
            PermissionLevel.READ_EXECUTE, new AtomicBoolean());
        AtomicBoolean started = new AtomicBoolean();
        try {
            Future<AgentResult> future = workers.submit(() -> {
                started.set(true);
                try {
                    return reviewer.getAgent().execute(AgentTypes.PEER_REVIEW, message, invocation);
                } finally {
                    reviewer.release();
                }
            });
            return new PendingReview(reviewer, future, started);
        } catch (RejectedExecutionException e) {
            reviewer.release();
            log.warn("Worker pool rejected review {} for {}", task.getTaskId(), reviewer.getAgentId());
            return null;
        }
    }

    private static ReviewDecision asDecision(String reviewerId, AgentResult result) {
        if (result == null || !(result.getPayload() instanceof ReviewDecision)) {
            log.warn("Reviewer {} returned no decision", reviewerId);
            return null;
        }
        ReviewDecision decision = (ReviewDecision) result.getPayload();
        return ReviewDecision.of(reviewerId, decision.getVerdict(), decision.getComment());
    }

    private Optional<AgentHandle> findExpert(String capabilityOrTag, Set<String> excluded, boolean capabilityOnly) {
        return registry.handles().stream()
            .filter(h -> !excluded.contains(h.getAgentId()))
            .filter(h -> matches(h, capabilityOrTag, capabilityOnly))
            .filter(AgentHandle::hasCapacity)
            .min(Comparator.comparingInt(AgentHandle::load).thenComparing(AgentHandle::getAgentId));
    }

    private static boolean matches(AgentHandle handle, String capabilityOrTag, boolean capabilityOnly) {
        boolean capable = handle.getDescriptor().findCapability(capabilityOrTag)
            .map(Capability::isAvailable)
            .orElse(false);
        return capable || (!capabilityOnly && handle.getDescriptor().getExpertiseDomains().contains(capabilityOrTag));
    }

    private void record(CollaborationTask task) {
        CollaborationStatus status = task.getStatus();
        log.info("Peer review {} for {} ended {}: {}",
            task.getTaskId(), task.getInitiatorAgentId(), status, task.getResolution());
        if (metrics != null) {
            metrics.recordReview(status.name());
        }
    }

    private void index(KnowledgeItem item) {
        if (item.getSupersedes() != null) {
            superseded.add(item.getSupersedes());
        }
        if (item.getTopic() != null) {
            currentByTopic.put(item.getTopic(), item);
        }
        if (item.getDomainTags() != null) {
            for (String tag : item.getDomainTags()) {
                byTag.computeIfAbsent(tag, t -> new TagIndex()).add(item);
            }
        }
    }

    private static final class PendingReview {
        private final AgentHandle reviewer;
        private final Future<AgentResult> future;
        private final AtomicBoolean started;

        private PendingReview(AgentHandle reviewer, Future<AgentResult> future, AtomicBoolean started) {
            this.reviewer = reviewer;
            this.future = future;
            this.started = started;
        }

        // a call cancelled before it ran never reaches its finally block
        void abandon() {
            if (future.cancel(true) && !started.get()) {
                reviewer.release();
            }
        }
    }

    // one lock per tag
    private static final class TagIndex {
        private final List<KnowledgeItem> items = new ArrayList<>();

        synchronized void add(KnowledgeItem item) {
            items.add(item);
        }

        synchronized List<KnowledgeItem> snapshot() {
            return new ArrayList<>(items);
        }
    }
}
