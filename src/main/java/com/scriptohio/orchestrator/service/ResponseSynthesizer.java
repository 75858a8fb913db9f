package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.AgentResponse;
import com.scriptohio.orchestrator.model.CollaborationStatus;
import com.scriptohio.orchestrator.model.CollaborationTask;
import com.scriptohio.orchestrator.model.ErrorKind;
import com.scriptohio.orchestrator.model.FailedSubtask;
import com.scriptohio.orchestrator.model.ResultConflict;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class ResponseSynthesizer {

    private static final Comparator<SubtaskOutcome> PREFERENCE = Comparator
        .comparingDouble((SubtaskOutcome o) -> o.confidence() == null ? 0.0 : o.confidence())
        .reversed()
        .thenComparing((SubtaskOutcome o) -> o.getAgentPermission() == null ? -1 : o.getAgentPermission().ordinal(),
            Comparator.reverseOrder());

    public AgentResponse synthesize(String requestId, Map<String, SubtaskOutcome> outcomes,
                                    Map<String, CollaborationTask> reviews, long durationMillis) {
        List<SubtaskOutcome> succeeded = new ArrayList<>();
        List<FailedSubtask> failed = new ArrayList<>();
        for (SubtaskOutcome outcome : outcomes.values()) {
            if (outcome.isSuccess()) {
                succeeded.add(outcome);
            } else {
                failed.add(outcome.toFailure());
            }
        }

        if (succeeded.isEmpty()) {
            return allFailed(requestId, failed, durationMillis);
        }

        Map<String, List<SubtaskOutcome>> byAction = new LinkedHashMap<>();
        for (SubtaskOutcome outcome : succeeded) {
            byAction.computeIfAbsent(outcome.getSubtask().getAction(), a -> new ArrayList<>()).add(outcome);
        }

        Set<String> kept = new LinkedHashSet<>();
        List<ResultConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, List<SubtaskOutcome>> entry : byAction.entrySet()) {
            List<SubtaskOutcome> ranked = new ArrayList<>(entry.getValue());
            ranked.sort(PREFERENCE);
            SubtaskOutcome best = ranked.get(0);
            List<SubtaskOutcome> tied = new ArrayList<>();
            for (SubtaskOutcome candidate : ranked) {
                if (PREFERENCE.compare(best, candidate) == 0) {
                    tied.add(candidate);
                }
            }
            tied.forEach(o -> kept.add(o.getSubtask().getId()));
            if (tied.size() > 1) {
                conflicts.add(ResultConflict.builder()
                    .action(entry.getKey())
                    .reason("equal confidence and permission level")
                    .results(payloads(tied))
                    .build());
            }
        }

        Map<String, Object> reviewMetadata = new LinkedHashMap<>();
        if (reviews != null) {
            reviews.forEach((subtaskId, task) -> {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("task_id", task.getTaskId());
                view.put("status", task.getStatus().name());
                view.put("reviewers", task.getReviewerIds());
                view.put("resolution", task.getResolution());
                reviewMetadata.put(subtaskId, view);

                SubtaskOutcome reviewed = outcomes.get(subtaskId);
                if (task.getStatus() == CollaborationStatus.CONFLICTED && reviewed != null) {
                    conflicts.add(ResultConflict.builder()
                        .action(reviewed.getSubtask().getAction())
                        .reason("peer review: " + task.getResolution())
                        .results(payloads(List.of(reviewed)))
                        .build());
                }
            });
        }

        Map<String, Object> result = new LinkedHashMap<>();
        List<SubtaskOutcome> winners = new ArrayList<>();
        for (SubtaskOutcome outcome : succeeded) {
            if (kept.contains(outcome.getSubtask().getId())) {
                result.put(outcome.getSubtask().getId(), outcome.payload());
                winners.add(outcome);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("subtasks", outcomes.size());
        metadata.put("succeeded", succeeded.size());
        if (!reviewMetadata.isEmpty()) {
            metadata.put("reviews", reviewMetadata);
        }

        return AgentResponse.builder()
            .requestId(requestId)
            .success(true)
            .result(result)
            .durationMillis(durationMillis)
            .agentId(winners.stream().map(SubtaskOutcome::getAgentId).distinct().collect(Collectors.joining(",")))
            .confidence(meanConfidence(winners))
            .failedSubtasks(failed)
            .conflicted(!conflicts.isEmpty())
            .conflicts(conflicts)
            .metadata(metadata)
            .build();
    }

    private static AgentResponse allFailed(String requestId, List<FailedSubtask> failed, long durationMillis) {
        ErrorKind kind = failed.isEmpty() ? ErrorKind.INTERNAL_AGENT_ERROR : failed.get(0).getErrorKind();
        String error = failed.isEmpty()
            ? "No subtasks were planned"
            : "All subtasks failed: " + failed.stream().map(FailedSubtask::describe).collect(Collectors.joining("; "));
        AgentResponse response = AgentResponse.failure(requestId, kind, error, durationMillis);
        response.setFailedSubtasks(failed);
        return response;
    }

    private static Map<String, Object> payloads(List<SubtaskOutcome> outcomes) {
        Map<String, Object> payloads = new LinkedHashMap<>();
        outcomes.forEach(o -> payloads.put(o.getSubtask().getId(), o.payload()));
        return payloads;
    }

    private static Double meanConfidence(List<SubtaskOutcome> outcomes) {
        OptionalDouble mean = outcomes.stream()
            .map(SubtaskOutcome::confidence)
            .filter(c -> c != null)
            .mapToDouble(Double::doubleValue)
            .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }
}
