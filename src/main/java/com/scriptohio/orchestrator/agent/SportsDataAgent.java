package com.scriptohio.orchestrator.agent;

import com.scriptohio.orchestrator.client.SportsDataClient;
import com.scriptohio.orchestrator.model.AgentDescriptor;
import com.scriptohio.orchestrator.model.Capability;
import com.scriptohio.orchestrator.model.PermissionLevel;

import java.time.Year;
import java.util.List;
import java.util.Map;

public class SportsDataAgent extends AbstractAnalyticsAgent {

    private final SportsDataClient client;

    public SportsDataAgent(String agentId, SportsDataClient client) {
        super(AgentDescriptor.builder()
            .agentType(AgentTypes.SPORTS_DATA)
            .agentId(agentId)
            .name("CFBD Integration")
            .permissionLevel(PermissionLevel.READ_EXECUTE)
            .capabilities(List.of(
                remote("fetch_games", "Games for a season, week and team", client),
                remote("fetch_ratings", "SP+ ratings for a season", client)))
            .expertiseDomains(List.of("live_data", "games", "ratings"))
            .maxConcurrentTasks(2)
            .build());
        this.client = client;
        on("fetch_games", this::fetchGames);
        on("fetch_ratings", this::fetchRatings);
    }

    private AgentResult fetchGames(Map<String, Object> parameters, AgentInvocation invocation) {
        List<Map<String, Object>> games = client.fetchGames(
            season(parameters), intParam(parameters, "week"), stringParam(parameters, "team", null));
        return AgentResult.of(games, 0.9);
    }

    private AgentResult fetchRatings(Map<String, Object> parameters, AgentInvocation invocation) {
        return AgentResult.of(client.fetchRatings(season(parameters)), 0.9);
    }

    private static int season(Map<String, Object> parameters) {
        Integer season = intParam(parameters, "season");
        return season == null ? Year.now().getValue() : season;
    }

    private static Capability remote(String name, String description, SportsDataClient client) {
        Capability capability = capability(name, description, PermissionLevel.READ_EXECUTE, 800,
            List.of("cfbd_api"));
        capability.setRequiredTools(List.of("cfbd_api"));
        capability.setAvailable(client != null && client.isConfigured());
        return capability;
    }
}
