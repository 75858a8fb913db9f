package com.scriptohio.orchestrator.service;

import com.scriptohio.orchestrator.model.ContextResource;

import java.util.Collection;

// one token per four characters, rounded up
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static long estimate(ContextResource resource) {
        return resource == null ? 0 : estimate(resource.getContent());
    }

    public static long estimate(Collection<ContextResource> resources) {
        return resources.stream().mapToLong(TokenEstimator::estimate).sum();
    }

    public static String truncate(String text, long tokens) {
        if (text == null) {
            return null;
        }
        long maxChars = Math.max(0, tokens) * CHARS_PER_TOKEN;
        return text.length() <= maxChars ? text : text.substring(0, (int) maxChars);
    }
}
