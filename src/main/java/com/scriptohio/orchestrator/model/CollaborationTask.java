package com.scriptohio.orchestrator.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Peer-review task. Status moves PENDING -> IN_REVIEW -> RESOLVED | CONFLICTED
 * and never leaves a terminal state.
 */
@Getter
public class CollaborationTask {
    private final String taskId;
    private final String initiatorAgentId;
    private final Object payload;
    private final Instant createdAt;
    private final List<String> reviewerIds = new ArrayList<>();
    private final Map<String, ReviewDecision> decisions = new LinkedHashMap<>();
    private CollaborationStatus status = CollaborationStatus.PENDING;
    private String resolution;

    public CollaborationTask(String taskId, String initiatorAgentId, Object payload, Instant createdAt) {
        this.taskId = taskId;
        this.initiatorAgentId = initiatorAgentId;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    public synchronized void assignReviewers(List<String> reviewers) {
        requireStatus(CollaborationStatus.PENDING);
        reviewerIds.addAll(reviewers);
    }

    public synchronized void startReview() {
        moveTo(CollaborationStatus.IN_REVIEW);
    }

    public synchronized void recordDecision(ReviewDecision decision) {
        requireStatus(CollaborationStatus.IN_REVIEW);
        if (!reviewerIds.contains(decision.getReviewerId())) {
            throw new IllegalArgumentException("Not an assigned reviewer: " + decision.getReviewerId());
        }
        decisions.putIfAbsent(decision.getReviewerId(), decision);
    }

    public synchronized void resolve(String resolution) {
        moveTo(CollaborationStatus.RESOLVED);
        this.resolution = resolution;
    }

    public synchronized void conflict(String resolution) {
        moveTo(CollaborationStatus.CONFLICTED);
        this.resolution = resolution;
    }

    public synchronized CollaborationStatus getStatus() {
        return status;
    }

    public synchronized String getResolution() {
        return resolution;
    }

    public synchronized List<String> getReviewerIds() {
        return Collections.unmodifiableList(new ArrayList<>(reviewerIds));
    }

    public synchronized Map<String, ReviewDecision> getDecisions() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
    }

    public synchronized long count(ReviewVerdict verdict) {
        return decisions.values().stream().filter(d -> d.getVerdict() == verdict).count();
    }

    private void moveTo(CollaborationStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException(String.format(
                "Collaboration task %s cannot move from %s to %s", taskId, status, next));
        }
        status = next;
    }

    private void requireStatus(CollaborationStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(String.format(
                "Collaboration task %s is %s, expected %s", taskId, status, expected));
        }
    }
}
