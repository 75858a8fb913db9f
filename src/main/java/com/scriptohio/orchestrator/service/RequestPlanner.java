package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.AgentRequest;
import com.scriptohio.orchestrator.model.SubTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class RequestPlanner {

    public static final String RECOMMEND_CONTENT = "recommend_content";
    public static final String GUIDE_LEARNING_PATH = "guide_learning_path";
    public static final String PREDICT_OUTCOME = "predict_outcome";
    public static final String GENERATE_ANALYSIS = "generate_analysis";
    public static final String FETCH_GAMES = "fetch_games";

    private static final List<String> LEARNING_WORDS = List.of("learn", "tutorial", "explain");
    private static final List<String> PATH_WORDS = List.of("path", "next", "guide");
    private static final List<String> PREDICTION_WORDS = List.of("predict", "forecast", "outcome");
    private static final List<String> ANALYSIS_WORDS = List.of("analy", "compare", "ranking", "insight");
    private static final List<String> DATA_WORDS = List.of("game", "scoreboard", "rating", "schedule");

    public List<SubTask> plan(AgentRequest request) {
        if (request.getSubtasks() != null && !request.getSubtasks().isEmpty()) {
            List<SubTask> given = new ArrayList<>();
            for (SubTask subtask : request.getSubtasks()) {
                given.add(subtask.toBuilder()
                    .agentType(subtask.getAgentType() != null ? subtask.getAgentType() : targetType(request))
                    .parameters(copy(subtask.getParameters()))
                    .dependsOn(subtask.getDependsOn() == null ? new ArrayList<>() : new ArrayList<>(subtask.getDependsOn()))
                    .build());
            }
            return given;
        }

        if (request.getAction() != null && !request.getAction().isBlank()) {
            return List.of(subtask(request, request.getAction(), List.of()));
        }

        return decompose(request);
    }

    private List<SubTask> decompose(AgentRequest request) {
        String query = request.getQuery() == null ? "" : request.getQuery().toLowerCase(Locale.ROOT);
        List<SubTask> plan = new ArrayList<>();

        if (RoleDetector.containsAny(query, LEARNING_WORDS)) {
            String action = RoleDetector.containsAny(query, PATH_WORDS) ? GUIDE_LEARNING_PATH : RECOMMEND_CONTENT;
            plan.add(subtask(request, action, List.of()));
        }
        if (RoleDetector.containsAny(query, PREDICTION_WORDS)) {
            plan.add(subtask(request, PREDICT_OUTCOME, List.of()));
        }
        boolean fetch = RoleDetector.containsAny(query, DATA_WORDS);
        if (fetch) {
            plan.add(subtask(request, FETCH_GAMES, List.of()));
        }
        if (RoleDetector.containsAny(query, ANALYSIS_WORDS)) {
            plan.add(subtask(request, GENERATE_ANALYSIS, fetch ? List.of(FETCH_GAMES) : List.of()));
        }

        if (plan.isEmpty()) {
            plan.add(subtask(request, RECOMMEND_CONTENT, List.of()));
        }
        return plan;
    }

    private static SubTask subtask(AgentRequest request, String action, List<String> dependsOn) {
        Map<String, Object> parameters = copy(request.getParameters());
        if (request.getQuery() != null) {
            parameters.putIfAbsent("query", request.getQuery());
        }
        return SubTask.builder()
            .id(action)
            .agentType(targetType(request))
            .action(action)
            .parameters(parameters)
            .dependsOn(new ArrayList<>(dependsOn))
            .build();
    }

    private static String targetType(AgentRequest request) {
        return request.isAutoRouted() ? null : request.getAgentType();
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? new HashMap<>() : new HashMap<>(source);
    }
}
