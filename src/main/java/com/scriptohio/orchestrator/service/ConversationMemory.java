package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.ConversationTurn;
import com.scriptohio.orchestrator.model.SessionSummary;
import com.scriptohio.orchestrator.store.SessionSummaryStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user conversation state: a ring of recent turns, the digest of the
 * open session, and the summaries of closed ones.
 * <p>
 * A session ends explicitly or once it has been idle for the configured
 * timeout. Idleness is checked on every access and by a periodic sweep.
 * Each user has its own lock; summaries are written to the store after the
 * lock is released, and store failures only cost persistence.
 */
@Slf4j
@Service
public class ConversationMemory {

    static final int RESPONSE_PREVIEW = 200;
    static final int MAX_PREFERRED_TOPICS = 5;
    static final String MEMORY_KEY = "conversation_memory";

    private static final Map<String, Integer> ROLE_EXPERTISE = Map.of(
        RoleDetector.ANALYST, 0,
        RoleDetector.PRODUCTION, 1,
        RoleDetector.DATA_SCIENTIST, 2
    );
    private static final List<String> EXPERTISE_LEVELS = List.of("beginner", "intermediate", "advanced");

    private final SessionSummaryStore store;
    private final Clock clock;
    private final int maxTurns;
    private final int recentTurns;
    private final Duration idleTimeout;
    private final Map<String, UserMemory> users = new ConcurrentHashMap<>();

    @Autowired
    public ConversationMemory(SessionSummaryStore store, Clock clock, OrchestratorProperties properties) {
        this(store, clock, properties.getMemory().getMaxTurnsPerUser(),
            properties.getMemory().getRecentTurnsInContext(), properties.getMemory().getIdleTimeout());
    }

    public ConversationMemory(SessionSummaryStore store, Clock clock, int maxTurns, int recentTurns,
                              Duration idleTimeout) {
        this.store = store;
        this.clock = clock;
        this.maxTurns = maxTurns;
        this.recentTurns = recentTurns;
        this.idleTimeout = idleTimeout;
    }

    @PostConstruct
    public void replay() {
        List<SessionSummary> stored;
        try {
            stored = store.loadAll();
        } catch (IOException e) {
            log.warn("Could not replay session summaries, starting with empty memory: {}", e.getMessage());
            return;
        }
        for (SessionSummary summary : stored) {
            if (summary.getUserId() != null) {
                memoryOf(summary.getUserId()).summaries.add(summary);
            }
        }
        log.info("Replayed {} session summaries for {} users", stored.size(), users.size());
    }

    public String startSession(String userId, String firstQuery) {
        UserMemory memory = memoryOf(userId);
        SessionSummary expired;
        String sessionId;
        memory.lock.lock();
        try {
            expired = expireIfIdle(memory);
            sessionId = ensureSession(memory, userId);
        } finally {
            memory.lock.unlock();
        }
        persist(expired);
        log.debug("Session {} active for user {} (topic {})", sessionId, userId, TopicExtractor.mainTopic(firstQuery));
        return sessionId;
    }

    public String addTurn(String userId, ConversationTurn turn) {
        UserMemory memory = memoryOf(userId);
        SessionSummary expired;
        String sessionId;
        memory.lock.lock();
        try {
            expired = expireIfIdle(memory);
            sessionId = ensureSession(memory, userId);
            ConversationTurn recorded = turn.toBuilder()
                .userId(userId)
                .sessionId(sessionId)
                .topic(turn.getTopic() != null ? turn.getTopic() : TopicExtractor.mainTopic(turn.getQuery()))
                .timestamp(turn.getTimestamp() != null ? turn.getTimestamp() : clock.instant())
                .build();
            memory.digest.fold(recorded);
            memory.ring.add(recorded);
            memory.lastActivity = clock.instant();
        } finally {
            memory.lock.unlock();
        }
        persist(expired);
        return sessionId;
    }

    // empty when there is no active session or it recorded no turns
    public Optional<SessionSummary> endSession(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return Optional.empty();
        }
        SessionSummary summary;
        memory.lock.lock();
        try {
            summary = close(memory);
        } finally {
            memory.lock.unlock();
        }
        persist(summary);
        return Optional.ofNullable(summary);
    }

    public Map<String, Object> enhanceContext(String userId, Map<String, Object> baseContext, String query) {
        Map<String, Object> enhanced = new LinkedHashMap<>(baseContext == null ? Map.of() : baseContext);
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return enhanced;
        }

        Map<String, Object> snapshot;
        memory.lock.lock();
        try {
            snapshot = describe(memory, query);
        } finally {
            memory.lock.unlock();
        }

        if (!snapshot.isEmpty()) {
            enhanced.put(MEMORY_KEY, snapshot);
        }
        return enhanced;
    }

    public List<ConversationTurn> recentTurns(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return List.of();
        }
        memory.lock.lock();
        try {
            return memory.ring.all();
        } finally {
            memory.lock.unlock();
        }
    }

    public Optional<SessionSummary> pendingDigest(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return Optional.empty();
        }
        memory.lock.lock();
        try {
            return memory.digest == null ? Optional.empty() : Optional.of(memory.digest.toSummary(clock.instant()));
        } finally {
            memory.lock.unlock();
        }
    }

    public Optional<String> activeSession(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return Optional.empty();
        }
        memory.lock.lock();
        try {
            return memory.digest == null ? Optional.empty() : Optional.of(memory.digest.getSessionId());
        } finally {
            memory.lock.unlock();
        }
    }

    public List<SessionSummary> summaries(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return List.of();
        }
        memory.lock.lock();
        try {
            return new ArrayList<>(memory.summaries);
        } finally {
            memory.lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${orchestrator.memory.sweep-interval:PT1M}")
    public void sweepIdleSessions() {
        int closed = 0;
        for (UserMemory memory : users.values()) {
            SessionSummary expired;
            memory.lock.lock();
            try {
                expired = expireIfIdle(memory);
            } finally {
                memory.lock.unlock();
            }
            if (expired != null) {
                persist(expired);
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Closed {} idle sessions", closed);
        }
    }

    private UserMemory memoryOf(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("user id is required");
        }
        return users.computeIfAbsent(userId, id -> new UserMemory(maxTurns));
    }

    // callers hold memory.lock
    private String ensureSession(UserMemory memory, String userId) {
        if (memory.digest == null) {
            String sessionId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            memory.digest = new SessionDigest(sessionId, userId, clock.instant());
            memory.lastActivity = clock.instant();
            log.info("Started conversation session {} for user {}", sessionId, userId);
        }
        return memory.digest.getSessionId();
    }

    private boolean isIdle(UserMemory memory) {
        return memory.digest != null && memory.lastActivity != null
            && !clock.instant().isBefore(memory.lastActivity.plus(idleTimeout));
    }

    private SessionSummary expireIfIdle(UserMemory memory) {
        if (!isIdle(memory)) {
            return null;
        }
        log.info("Session {} idle since {}, closing", memory.digest.getSessionId(), memory.lastActivity);
        return close(memory);
    }

    private SessionSummary close(UserMemory memory) {
        SessionDigest digest = memory.digest;
        if (digest == null) {
            return null;
        }
        memory.digest = null;
        if (digest.getTurnCount() == 0) {
            return null;
        }
        SessionSummary summary = digest.toSummary(clock.instant());
        memory.summaries.add(summary);
        log.info("Ended conversation session {} for user {}: {}",
            summary.getSessionId(), summary.getUserId(), summary.getDigest());
        return summary;
    }

    private void persist(SessionSummary summary) {
        if (summary == null) {
            return;
        }
        try {
            if (!store.save(summary)) {
                log.debug("Session summary {} already stored", summary.getSessionId());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist session summary {}: {}", summary.getSessionId(), e.getMessage());
        }
    }

    // an idle session is shown as if it had been closed; closing it is left to writers and the sweep
    private Map<String, Object> describe(UserMemory memory, String query) {
        List<SessionSummary> summaries = memory.summaries;
        SessionDigest open = memory.digest;
        if (isIdle(memory)) {
            summaries = new ArrayList<>(memory.summaries);
            if (open.getTurnCount() > 0) {
                summaries.add(open.toSummary(clock.instant()));
            }
            open = null;
        }

        Map<String, Object> snapshot = new LinkedHashMap<>();
        List<ConversationTurn> recent = memory.ring.latest(recentTurns);
        if (!recent.isEmpty()) {
            List<Map<String, Object>> turns = new ArrayList<>();
            for (ConversationTurn turn : recent) {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("query", turn.getQuery());
                view.put("response", turn.getResponse() == null ? null
                    : SessionDigest.clip(turn.getResponse(), RESPONSE_PREVIEW));
                view.put("topic", turn.getTopic());
                view.put("role", turn.getDetectedRole());
                view.put("tokens_used", turn.getTokensUsed());
                view.put("timestamp", String.valueOf(turn.getTimestamp()));
                turns.add(view);
            }
            snapshot.put("recent_turns", turns);
        }

        relevantSummary(summaries, query).ifPresent(summary -> {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("session_id", summary.getSessionId());
            view.put("digest", summary.getDigest());
            view.put("topics", summary.getTopics());
            view.put("key_insights", summary.getKeyInsights());
            snapshot.put("relevant_summary", view);
        });

        List<String> roles = new ArrayList<>();
        summaries.forEach(s -> {
            if (s.getDominantRole() != null) {
                roles.add(s.getDominantRole());
            }
        });
        memory.ring.all().forEach(t -> {
            if (t.getDetectedRole() != null) {
                roles.add(t.getDetectedRole());
            }
        });
        List<String> preferredTopics = preferredTopics(summaries, open);
        if (!roles.isEmpty() || !preferredTopics.isEmpty()) {
            Map<String, Object> preferences = new LinkedHashMap<>();
            preferences.put("expertise_level", expertiseLevel(roles));
            preferences.put("expertise_trend", expertiseTrend(roles));
            preferences.put("preferred_topics", preferredTopics);
            snapshot.put("preferences", preferences);
        }

        ConversationTurn last = memory.ring.last();
        if (last != null) {
            Map<String, Object> hints = new LinkedHashMap<>();
            hints.put("last_topic", last.getTopic());
            hints.put("last_role", last.getDetectedRole());
            hints.put("session_id", open == null ? null : open.getSessionId());
            snapshot.put("continuity_hints", hints);
        }
        return snapshot;
    }

    // latest summary wins ties
    static Optional<SessionSummary> relevantSummary(List<SessionSummary> summaries, String query) {
        Set<String> wanted = TopicExtractor.topics(query);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        SessionSummary best = null;
        long bestOverlap = 0;
        for (SessionSummary summary : summaries) {
            long overlap = summary.getTopics().stream().filter(wanted::contains).count();
            if (overlap > 0 && overlap >= bestOverlap) {
                best = summary;
                bestOverlap = overlap;
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> preferredTopics(List<SessionSummary> summaries, SessionDigest open) {
        Map<String, Integer> counts = new HashMap<>();
        for (SessionSummary summary : summaries) {
            summary.getTopics().forEach(topic -> counts.merge(topic, 1, Integer::sum));
        }
        if (open != null) {
            open.getTopicCounts().forEach((topic, n) -> counts.merge(topic, n, Integer::sum));
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey()))
            .limit(MAX_PREFERRED_TOPICS)
            .map(Map.Entry::getKey)
            .toList();
    }

    private static String expertiseLevel(List<String> roles) {
        if (roles.isEmpty()) {
            return EXPERTISE_LEVELS.get(0);
        }
        return EXPERTISE_LEVELS.get(ROLE_EXPERTISE.getOrDefault(roles.get(roles.size() - 1), 0));
    }

    static String expertiseTrend(List<String> roles) {
        if (roles.size() < 2) {
            return "steady";
        }
        int half = roles.size() / 2;
        double older = meanExpertise(roles.subList(0, half));
        double newer = meanExpertise(roles.subList(roles.size() - half, roles.size()));
        if (newer > older) {
            return "rising";
        }
        return newer < older ? "falling" : "steady";
    }

    private static double meanExpertise(List<String> roles) {
        return roles.stream().mapToInt(r -> ROLE_EXPERTISE.getOrDefault(r, 0)).average().orElse(0);
    }

    private static final class UserMemory {
        private final ReentrantLock lock = new ReentrantLock();
        private final TurnRing ring;
        private final List<SessionSummary> summaries = new ArrayList<>();
        private SessionDigest digest;
        private Instant lastActivity;

        private UserMemory(int maxTurns) {
            this.ring = new TurnRing(maxTurns);
        }
    }
}
