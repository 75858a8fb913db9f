package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.PermissionLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class InsightGeneratorAgent extends AbstractAnalyticsAgent {

    public InsightGeneratorAgent(String agentId) {
        super(AgentDescriptor.builder()
            .agentType(AgentTypes.INSIGHT_GENERATOR)
            .agentId(agentId)
            .name("Insight Generator")
            .permissionLevel(PermissionLevel.READ_EXECUTE)
            .capabilities(List.of(
                capability("generate_analysis", "Scoring margin summary and team ranking",
                    PermissionLevel.READ_EXECUTE, 1_500, List.of("games"))))
            .expertiseDomains(List.of("analysis", "rankings", "team_efficiency"))
            .build());
        on("generate_analysis", this::generateAnalysis);
    }

    private AgentResult generateAnalysis(Map<String, Object> parameters, AgentInvocation invocation) {
        List<Map<String, Object>> games = collectGames(parameters);
        Map<String, double[]> margins = new TreeMap<>();

        for (Map<String, Object> game : games) {
            invocation.checkCancelled();
            String home = string(game.get("home_team"));
            String away = string(game.get("away_team"));
            Double homePoints = number(game.get("home_points"));
            Double awayPoints = number(game.get("away_points"));
            if (home == null || away == null || homePoints == null || awayPoints == null) {
                continue;
            }
            accumulate(margins, home, homePoints - awayPoints);
            accumulate(margins, away, awayPoints - homePoints);
        }

        List<Map<String, Object>> ranking = new ArrayList<>();
        margins.entrySet().stream()
            .sorted((a, b) -> Double.compare(average(b.getValue()), average(a.getValue())))
            .forEach(entry -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("team", entry.getKey());
                row.put("games", (int) entry.getValue()[1]);
                row.put("average_margin", Math.round(average(entry.getValue()) * 10.0) / 10.0);
                ranking.add(row);
            });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("analysis_type", stringParam(parameters, "analysis_type", "performance"));
        payload.put("games_analyzed", games.size());
        payload.put("ranking", ranking);

        List<String> insights = new ArrayList<>();
        if (!ranking.isEmpty()) {
            Map<String, Object> top = ranking.get(0);
            insights.add(String.format("%s leads with an average margin of %s over %s games",
                top.get("team"), top.get("average_margin"), top.get("games")));
        }

        double confidence = games.isEmpty() ? 0.3 : Math.min(0.95, 0.5 + games.size() * 0.05);
        return AgentResult.builder()
            .payload(payload)
            .confidence(confidence)
            .insights(insights)
            .domainTags(List.of("rankings", "team_efficiency"))
            .build();
    }

    private static List<Map<String, Object>> collectGames(Map<String, Object> parameters) {
        List<Map<String, Object>> games = new ArrayList<>();
        addRows(games, parameters.get("games"));
        Object upstream = parameters.get("upstream");
        if (upstream instanceof Map<?, ?> upstreamResults) {
            for (Object result : upstreamResults.values()) {
                addRows(games, result);
            }
        }
        return games;
    }

    @SuppressWarnings("unchecked")
    private static void addRows(List<Map<String, Object>> target, Object source) {
        if (source instanceof Collection<?> rows) {
            for (Object row : rows) {
                if (row instanceof Map<?, ?> map) {
                    target.add((Map<String, Object>) map);
                }
            }
        }
    }

    private static void accumulate(Map<String, double[]> margins, String team, double margin) {
        double[] totals = margins.computeIfAbsent(team, k -> new double[2]);
        totals[0] += margin;
        totals[1] += 1;
    }

    private static double average(double[] totals) {
        return totals[1] == 0 ? 0 : totals[0] / totals[1];
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static Double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }
}
