package com.scriptohio.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    private int workerPoolSize = 8;

    // applied to subtasks that do not carry their own timeout
    private Duration subtaskTimeout = Duration.ofSeconds(30);

    // request ids remembered for duplicate detection
    private int requestIdMemory = 10_000;

    private Context context = new Context();
    private Memory memory = new Memory();
    private Collaboration collaboration = new Collaboration();
    private SportsData sportsData = new SportsData();
    private List<AgentInstance> agents = new ArrayList<>();

    @Data
    public static class Context {
        private long globalTokenBudget = 100_000;
        private Duration cacheTtl = Duration.ofMinutes(10);
        private long cacheMaxEntries = 1_000;
        private String profilesLocation = "classpath:context-profiles.yaml";
        private String catalogLocation = "classpath:context-catalog.yaml";
    }

    @Data
    public static class Memory {
        private int maxTurnsPerUser = 10;
        private int recentTurnsInContext = 5;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(1);
        private String dataPath = "data";
    }

    @Data
    public static class Collaboration {
        private int reviewers = 1;
        private Duration reviewTimeout = Duration.ofSeconds(10);
        private String dataPath = "data";
    }

    @Data
    public static class SportsData {
        private String baseUrl = "https://api.collegefootballdata.com";
        private String apiKey;
        private Duration minDelay = Duration.ofMillis(200);
    }

    @Data
    public static class AgentInstance {
        private String type;
        private String id;
    }
}
