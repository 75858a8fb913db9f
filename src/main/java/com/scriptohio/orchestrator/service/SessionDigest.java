package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.ConversationTurn;
import com.scriptohio.orchestrator.model.SessionSummary;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// every turn is folded in on arrival, so the summary outlives the ring
@Getter
public class SessionDigest {

    static final int MAX_KEY_INSIGHTS = 5;
    static final int INSIGHT_LENGTH = 150;
    static final List<String> INSIGHT_WORDS = List.of("important", "key", "critical", "essential");

    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";

    private final String sessionId;
    private final String userId;
    private final Instant startedAt;
    private Instant lastTurnAt;
    private int turnCount;
    private long totalTokens;
    private final Map<String, Integer> topicCounts = new LinkedHashMap<>();
    private final Map<String, Integer> roleCounts = new LinkedHashMap<>();
    private final Map<String, Integer> outcomeTally = new LinkedHashMap<>();
    private final List<String> keyInsights = new ArrayList<>();
    private String lastRole;

    public SessionDigest(String sessionId, String userId, Instant startedAt) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.startedAt = startedAt;
        outcomeTally.put(SUCCEEDED, 0);
        outcomeTally.put(FAILED, 0);
    }

    public void fold(ConversationTurn turn) {
        turnCount++;
        totalTokens += turn.getTokensUsed();
        lastTurnAt = turn.getTimestamp();
        String topic = turn.getTopic() != null ? turn.getTopic() : TopicExtractor.mainTopic(turn.getQuery());
        topicCounts.merge(topic, 1, Integer::sum);
        if (turn.getDetectedRole() != null) {
            roleCounts.merge(turn.getDetectedRole(), 1, Integer::sum);
            lastRole = turn.getDetectedRole();
        }
        outcomeTally.merge(turn.isSuccess() ? SUCCEEDED : FAILED, 1, Integer::sum);

        String response = turn.getResponse();
        if (response != null && keyInsights.size() < MAX_KEY_INSIGHTS
            && RoleDetector.containsAny(response.toLowerCase(Locale.ROOT), INSIGHT_WORDS)) {
            keyInsights.add(clip(response, INSIGHT_LENGTH));
        }
    }

    // ties go to the role seen last
    public String dominantRole() {
        String dominant = null;
        int best = 0;
        for (Map.Entry<String, Integer> entry : roleCounts.entrySet()) {
            if (entry.getValue() > best || (entry.getValue() == best && entry.getKey().equals(lastRole))) {
                dominant = entry.getKey();
                best = entry.getValue();
            }
        }
        return dominant;
    }

    public SessionSummary toSummary(Instant endedAt) {
        List<String> topics = new ArrayList<>(topicCounts.keySet());
        return SessionSummary.builder()
            .sessionId(sessionId)
            .userId(userId)
            .startedAt(startedAt)
            .endedAt(endedAt)
            .turnCount(turnCount)
            .totalTokens(totalTokens)
            .dominantRole(dominantRole())
            .topics(topics)
            .outcomeTally(new LinkedHashMap<>(outcomeTally))
            .keyInsights(new ArrayList<>(keyInsights))
            .digest(String.format("%d turns (%d succeeded, %d failed) on %s using %d tokens",
                turnCount, outcomeTally.get(SUCCEEDED), outcomeTally.get(FAILED),
                topics.isEmpty() ? "nothing" : String.join(", ", topics), totalTokens))
            .build();
    }

    static String clip(String text, int max) {
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }
}
