package com.williamcallahan.knowledgeindex.service.chunking;

/**
 * Cheap token estimate of roughly four characters per token.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int charsForTokens(int tokens) {
        return Math.max(0, tokens) * CHARS_PER_TOKEN;
    }

    /**
     * Overlap actually applied: an overlap that would consume the whole window shrinks to a quarter of it.
     */
    static int effectiveOverlapTokens(int maxTokens, int overlapTokens) {
        return overlapTokens >= maxTokens ? maxTokens / 4 : overlapTokens;
    }
}
