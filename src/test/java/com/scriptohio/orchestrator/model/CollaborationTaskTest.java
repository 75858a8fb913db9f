package com.scriptohio.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollaborationTaskTest {

    private CollaborationTask newTask() {
        return new CollaborationTask("t1", "agent-a", "payload", Instant.EPOCH);
    }

    @Test
    void shouldMoveThroughReviewToResolved() {
        CollaborationTask task = newTask();
        task.assignReviewers(List.of("qa-1"));
        task.startReview();
        task.recordDecision(ReviewDecision.of("qa-1", ReviewVerdict.APPROVE, "ok"));
        task.resolve("1 of 1 approved");

        assertEquals(CollaborationStatus.RESOLVED, task.getStatus());
        assertEquals(1, task.count(ReviewVerdict.APPROVE));
        assertTrue(task.getStatus().isTerminal());
    }

    @Test
    void shouldNeverLeaveTerminalState() {
        CollaborationTask task = newTask();
        task.conflict("no reviewer available");

        assertThrows(IllegalStateException.class, task::startReview);
        assertThrows(IllegalStateException.class, () -> task.resolve("late"));
        assertEquals(CollaborationStatus.CONFLICTED, task.getStatus());
        assertEquals("no reviewer available", task.getResolution());
    }

    @Test
    void shouldNotResolveWithoutReview() {
        CollaborationTask task = newTask();

        assertThrows(IllegalStateException.class, () -> task.resolve("skip"));
        assertEquals(CollaborationStatus.PENDING, task.getStatus());
    }

    @Test
    void shouldRejectDecisionFromUnassignedReviewer() {
        CollaborationTask task = newTask();
        task.assignReviewers(List.of("qa-1"));
        task.startReview();

        assertThrows(IllegalArgumentException.class,
            () -> task.recordDecision(ReviewDecision.of("intruder", ReviewVerdict.APPROVE, "")));
        assertTrue(task.getDecisions().isEmpty());
    }

    @Test
    void shouldKeepFirstDecisionPerReviewer() {
        CollaborationTask task = newTask();
        task.assignReviewers(List.of("qa-1"));
        task.startReview();
        task.recordDecision(ReviewDecision.of("qa-1", ReviewVerdict.REJECT, "bad"));
        task.recordDecision(ReviewDecision.of("qa-1", ReviewVerdict.APPROVE, "changed mind"));

        assertEquals(ReviewVerdict.REJECT, task.getDecisions().get("qa-1").getVerdict());
    }
}
