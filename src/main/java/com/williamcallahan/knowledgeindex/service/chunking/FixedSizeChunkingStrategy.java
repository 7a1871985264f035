package com.williamcallahan.knowledgeindex.service.chunking;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Emits token-budgeted windows with overlap, pulling each window end back to the nearest natural break.
 *
 * <p>Break preference is paragraph, then line, then sentence, then whitespace, searched within a short
 * window before the target offset. Fragments below the minimum size are dropped unless they end the text.</p>
 */
@Component
public class FixedSizeChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "FixedSize";

    private static final int MAX_BREAK_SEARCH_CHARS = 100;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ChunkDraft> chunk(ParsedDocument document, ChunkingSettings settings) {
        String content = document.content();
        if (content.isBlank()) {
            return List.of();
        }
        int maxChars = TokenEstimator.charsForTokens(settings.maxChunkSize());
        int overlapChars = TokenEstimator.charsForTokens(
                TokenEstimator.effectiveOverlapTokens(settings.maxChunkSize(), settings.overlap()));
        int length = content.length();

        List<ChunkDraft> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = findBoundary(content, start, start + maxChars);
            int trimmedStart = start;
            int trimmedEnd = end;
            while (trimmedStart < trimmedEnd && Character.isWhitespace(content.charAt(trimmedStart))) {
                trimmedStart++;
            }
            while (trimmedEnd > trimmedStart && Character.isWhitespace(content.charAt(trimmedEnd - 1))) {
                trimmedEnd--;
            }
            if (trimmedEnd > trimmedStart) {
                String text = content.substring(trimmedStart, trimmedEnd);
                int tokens = TokenEstimator.estimateTokens(text);
                if (tokens >= settings.minChunkSize() || end >= length) {
                    chunks.add(new ChunkDraft(
                            text, chunks.size(), tokens, trimmedStart, trimmedEnd, Map.of(METADATA_STRATEGY, NAME)));
                }
            }
            if (end >= length) {
                break;
            }
            start = nextWindowStart(content, start, end, overlapChars);
        }
        return List.copyOf(chunks);
    }

    /**
     * Finds where a window starting at {@code start} should end when aiming for {@code target}.
     *
     * <p>A target at or beyond the content length returns the content length. Otherwise the result lies in
     * {@code (start, target]}.</p>
     */
    static int findBoundary(String content, int start, int target) {
        int length = content.length();
        if (target >= length) {
            return length;
        }
        int searchWindow = Math.min(MAX_BREAK_SEARCH_CHARS, (target - start) / 4);
        int floor = Math.max(start + 1, target - searchWindow);

        for (int candidate = Math.min(target, length); candidate >= floor; candidate--) {
            if (candidate - 2 >= start && content.charAt(candidate - 1) == '\n' && content.charAt(candidate - 2) == '\n') {
                return candidate;
            }
        }
        for (int candidate = Math.min(target, length); candidate >= floor; candidate--) {
            if (content.charAt(candidate - 1) == '\n') {
                return candidate;
            }
        }
        for (int candidate = Math.min(target, length); candidate >= floor; candidate--) {
            if (candidate - 2 >= start && isSentenceEnd(content.charAt(candidate - 2)) && content.charAt(candidate - 1) == ' ') {
                return candidate;
            }
        }
        for (int candidate = Math.min(target, length); candidate >= floor; candidate--) {
            if (Character.isWhitespace(content.charAt(candidate - 1))) {
                return candidate;
            }
        }
        return target;
    }

    private static int nextWindowStart(String content, int start, int end, int overlapChars) {
        int next = end - overlapChars;
        if (overlapChars > 0 && next > start) {
            // begin the overlap on a word boundary
            for (int candidate = next; candidate < end; candidate++) {
                if (Character.isWhitespace(content.charAt(candidate))) {
                    next = candidate + 1;
                    break;
                }
            }
        }
        return next > start ? next : end;
    }

    private static boolean isSentenceEnd(char character) {
        return character == '.' || character == '!' || character == '?';
    }
}
