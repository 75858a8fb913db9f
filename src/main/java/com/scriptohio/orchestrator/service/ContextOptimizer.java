package com.scriptohio.orchestrator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.scriptohio.orchestrator.config.OrchestratorProperties;
import com.scriptohio.orchestrator.model.ContextProfile;
import com.scriptohio.orchestrator.model.ContextResource;
import com.scriptohio.orchestrator.model.OptimizedContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces raw context to what a role may see and what fits its token budget.
 * <p>
 * Resources are grouped by the profile's focus areas. Whole areas are dropped
 * from the lowest priority upward; the highest-priority area is never dropped
 * and is trimmed instead, first by removing its trailing resources and then by
 * truncating the last remaining one. Results are cached by role and raw
 * content hash.
 */
@Slf4j
@Service
public class ContextOptimizer {

    static final String OTHER_AREA = "other";

    private final ContextProfileLoader profileLoader;
    private final long globalTokenBudget;
    private final Cache<String, OptimizedContext> cache;
    private final OrchestratorMetrics metrics;

    @Autowired
    public ContextOptimizer(ContextProfileLoader profileLoader, OrchestratorProperties properties,
                            OrchestratorMetrics metrics) {
        this(profileLoader, properties.getContext().getGlobalTokenBudget(),
            properties.getContext().getCacheTtl(), properties.getContext().getCacheMaxEntries(), metrics);
    }

    public ContextOptimizer(ContextProfileLoader profileLoader, long globalTokenBudget,
                            Duration cacheTtl, long cacheMaxEntries, OrchestratorMetrics metrics) {
        this.profileLoader = profileLoader;
        this.globalTokenBudget = globalTokenBudget;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(cacheMaxEntries)
                .recordStats()
                .build();
        log.info("Context optimizer ready: globalTokenBudget={}, cacheTtl={}", globalTokenBudget, cacheTtl);
    }

    // null or empty rawContext means the configured catalog
    public OptimizedContext load(String role, List<ContextResource> rawContext) {
        List<ContextResource> raw = rawContext == null || rawContext.isEmpty()
            ? profileLoader.catalog()
            : rawContext;
        String hash = contentHash(raw);
        boolean[] computed = {false};
        OptimizedContext context = cache.get(role + ":" + hash, key -> {
            computed[0] = true;
            return optimize(role, raw, hash);
        });
        if (metrics != null) {
            metrics.recordContextCache(!computed[0]);
        }
        return context;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long budgetFor(ContextProfile profile) {
        return (long) Math.floor(profile.getTokenBudgetFraction() * globalTokenBudget);
    }

    OptimizedContext optimize(String role, List<ContextResource> raw, String hash) {
        ContextProfile profile = profileLoader.profile(role).orElseGet(() -> {
            ContextProfile fallback = profileLoader.mostRestrictive();
            log.warn("Unknown role '{}', using most restrictive profile {}", role, fallback.getRole());
            return fallback;
        });
        long budget = budgetFor(profile);
        long originalTokens = TokenEstimator.estimate(raw);

        // priority -> resources, highest priority first, input order kept inside a group
        TreeMap<Integer, List<ContextResource>> groups = new TreeMap<>();
        raw.stream()
            .filter(profile::isVisible)
            .forEach(r -> groups.computeIfAbsent(profile.priorityOf(r), p -> new ArrayList<>()).add(r));

        List<String> dropped = new ArrayList<>();
        long tokens = groups.values().stream().mapToLong(TokenEstimator::estimate).sum();
        while (tokens > budget && groups.size() > 1) {
            Map.Entry<Integer, List<ContextResource>> lowest = groups.pollLastEntry();
            tokens -= TokenEstimator.estimate(lowest.getValue());
            dropped.add(areaName(profile, lowest.getKey()));
        }

        List<ContextResource> kept = new ArrayList<>();
        groups.values().forEach(kept::addAll);
        boolean truncated = false;
        if (tokens > budget) {
            truncated = true;
            while (kept.size() > 1 && tokens > budget) {
                tokens -= TokenEstimator.estimate(kept.remove(kept.size() - 1));
            }
            if (tokens > budget) {
                ContextResource last = kept.remove(kept.size() - 1);
                long room = budget - (tokens - TokenEstimator.estimate(last));
                ContextResource shortened = last.toBuilder()
                    .content(TokenEstimator.truncate(last.getContent(), room))
                    .build();
                kept.add(shortened);
                tokens = TokenEstimator.estimate(kept);
            }
        }

        if (!dropped.isEmpty() || truncated) {
            log.debug("Context for role {} reduced from {} to {} tokens (budget {}), dropped areas {}",
                profile.getRole(), originalTokens, tokens, budget, dropped);
        }

        return OptimizedContext.builder()
            .role(profile.getRole())
            .dataScope(profile.getDataScope())
            .budgetTokens(budget)
            .originalTokens(originalTokens)
            .estimatedTokens(tokens)
            .truncated(truncated)
            .contentHash(hash)
            .resources(kept.stream().map(r -> r.toBuilder().build()).toList())
            .droppedFocusAreas(List.copyOf(dropped))
            .build();
    }

    static String contentHash(List<ContextResource> resources) {
        StringBuilder sb = new StringBuilder();
        resources.forEach(r -> sb.append(r.getId()).append('|')
                .append(r.getKind()).append('|')
                .append(r.getFocusArea()).append('|')
                .append(r.getContent()).append('\n'));
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static String areaName(ContextProfile profile, int priority) {
        return priority < profile.getFocusAreas().size() ? profile.getFocusAreas().get(priority) : OTHER_AREA;
    }
}
