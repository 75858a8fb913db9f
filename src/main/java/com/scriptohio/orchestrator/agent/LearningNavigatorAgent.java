package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.PermissionLevel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class LearningNavigatorAgent extends AbstractAnalyticsAgent {

    private static final List<String> STARTER_PACK = List.of(
        "starter_pack/00_data_dictionary.ipynb",
        "starter_pack/01_intro_to_data.ipynb",
        "starter_pack/02_build_simple_rankings.ipynb",
        "starter_pack/03_metrics_comparison.ipynb",
        "starter_pack/04_team_similarity.ipynb",
        "starter_pack/05_matchup_predictor.ipynb");

    private static final List<String> MODEL_PACK = List.of(
        "model_pack/01_linear_regression_margin.ipynb",
        "model_pack/02_random_forest_team_points.ipynb",
        "model_pack/03_xgboost_win_probability.ipynb",
        "model_pack/05_logistic_regression_win_probability.ipynb",
        "model_pack/06_shap_interpretability.ipynb",
        "model_pack/07_stacked_ensemble.ipynb");

    public LearningNavigatorAgent(String agentId) {
        super(AgentDescriptor.builder()
            .agentType(AgentTypes.LEARNING_NAVIGATOR)
            .agentId(agentId)
            .name("Learning Navigator")
            .permissionLevel(PermissionLevel.READ_ONLY)
            .capabilities(List.of(
                capability("recommend_content", "Recommend notebooks for a query and skill level",
                    PermissionLevel.READ_ONLY, 200, List.of("starter_pack", "model_pack")),
                capability("guide_learning_path", "Ordered learning path from the current notebook",
                    PermissionLevel.READ_ONLY, 300, List.of("starter_pack", "model_pack"))))
            .expertiseDomains(List.of("education", "notebooks"))
            .build());
        on("recommend_content", this::recommendContent);
        on("guide_learning_path", this::guideLearningPath);
    }

    private AgentResult recommendContent(Map<String, Object> parameters, AgentInvocation invocation) {
        String skill = skillLevel(parameters, invocation);
        String query = stringParam(parameters, "query", "").toLowerCase(Locale.ROOT);

        List<String> pool = "beginner".equals(skill) ? STARTER_PACK : MODEL_PACK;
        List<String> recommendations = new ArrayList<>();
        for (String notebook : pool) {
            if (matches(notebook, query)) {
                recommendations.add(notebook);
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.addAll(pool.subList(0, Math.min(3, pool.size())));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("skill_level", skill);
        payload.put("recommendations", recommendations);
        return AgentResult.of(payload, 0.8);
    }

    private AgentResult guideLearningPath(Map<String, Object> parameters, AgentInvocation invocation) {
        String current = stringParam(parameters, "current_notebook", null);
        List<String> path = new ArrayList<>(STARTER_PACK);
        path.addAll(MODEL_PACK);

        int start = current == null ? 0 : Math.max(0, path.indexOf(current) + 1);
        List<String> remaining = path.subList(Math.min(start, path.size()), path.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("current_notebook", current);
        payload.put("learning_path", new ArrayList<>(remaining.subList(0, Math.min(5, remaining.size()))));
        return AgentResult.of(payload, 0.9);
    }

    private static String skillLevel(Map<String, Object> parameters, AgentInvocation invocation) {
        Object hint = parameters.getOrDefault("skill_level", invocation.getUserContext().get("skill_level"));
        return hint == null ? "beginner" : hint.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean matches(String notebook, String query) {
        if (query.isBlank()) {
            return false;
        }
        String name = notebook.substring(notebook.indexOf('/') + 1).replace(".ipynb", "");
        for (String word : name.split("_")) {
            if (word.length() > 3 && query.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
