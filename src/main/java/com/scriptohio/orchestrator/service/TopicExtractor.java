package com.scriptohio.orchestrator.service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// the first match in declaration order is the main topic
public final class TopicExtractor {

    public static final String GENERAL = "general";

    private static final Map<String, List<String>> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("predictions", List.of("predict", "outcome", "winner"));
        TOPICS.put("modeling", List.of("model", "algorithm", "regression"));
        TOPICS.put("data_analysis", List.of("data", "dataset", "features"));
        TOPICS.put("learning", List.of("learn", "tutorial", "explain"));
        TOPICS.put("rankings", List.of("rank", "rating", "best"));
    }

    private TopicExtractor() {
    }

    public static String mainTopic(String query) {
        Set<String> topics = topics(query);
        return topics.isEmpty() ? GENERAL : topics.iterator().next();
    }

    public static Set<String> topics(String query) {
        Set<String> found = new LinkedHashSet<>();
        if (query == null) {
            return found;
        }
        String text = query.toLowerCase(Locale.ROOT);
        TOPICS.forEach((topic, keywords) -> {
            if (RoleDetector.containsAny(text, keywords)) {
                found.add(topic);
            }
        });
        return found;
    }
}
