package com.williamcallahan.knowledgeindex.service.chunking;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits on progressively finer separators until every piece fits the token budget.
 *
 * <p>Each chunk after the first is prefixed with the trailing overlap of the text before it. Offsets are
 * located by searching forward from a running position that never exceeds the content length.</p>
 */
@Component
public class RecursiveChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "Recursive";

    private static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ");

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
        int segmentChars = Math.max(1, maxChars - overlapChars);

        List<String> segments = new ArrayList<>();
        splitRecursively(content, SEPARATORS, segmentChars, segments);

        List<ChunkDraft> chunks = new ArrayList<>();
        int runningOffset = 0;
        int previousSegmentEnd = -1;
        for (String rawSegment : segments) {
            String segment = rawSegment.strip();
            if (segment.isEmpty()) {
                continue;
            }
            int searchFrom = clampOffset(runningOffset, content.length());
            int segmentStart = content.indexOf(segment, searchFrom);
            if (segmentStart < 0) {
                segmentStart = searchFrom;
            }
            int segmentEnd = Math.min(content.length(), segmentStart + segment.length());

            int chunkStart = segmentStart;
            if (previousSegmentEnd >= 0 && overlapChars > 0) {
                chunkStart = overlapStart(content, previousSegmentEnd, overlapChars);
            }
            // keep the whole chunk inside the budget even when the gap between segments is wide
            chunkStart = Math.max(chunkStart, segmentEnd - maxChars);
            while (chunkStart < segmentStart && Character.isWhitespace(content.charAt(chunkStart))) {
                chunkStart++;
            }
            String text = content.substring(chunkStart, segmentEnd);
            int tokens = TokenEstimator.estimateTokens(text);
            boolean last = segmentEnd >= content.stripTrailing().length();
            if (tokens >= settings.minChunkSize() || last) {
                chunks.add(new ChunkDraft(
                        text, chunks.size(), tokens, chunkStart, segmentEnd, Map.of(METADATA_STRATEGY, NAME)));
            }
            previousSegmentEnd = segmentEnd;
            runningOffset = segmentEnd;
        }
        return List.copyOf(chunks);
    }

    /**
     * Bounds a search position to the content so a position pushed past the end cannot fail the lookup.
     */
    static int clampOffset(int offset, int contentLength) {
        return Math.max(0, Math.min(offset, contentLength));
    }

    private static void splitRecursively(String text, List<String> separators, int maxChars, List<String> out) {
        if (text.length() <= maxChars) {
            out.add(text);
            return;
        }
        if (separators.isEmpty()) {
            for (int start = 0; start < text.length(); start += maxChars) {
                out.add(text.substring(start, Math.min(text.length(), start + maxChars)));
            }
            return;
        }
        String separator = separators.get(0);
        List<String> finer = separators.subList(1, separators.size());
        StringBuilder current = new StringBuilder();
        for (String part : splitKeepingSeparator(text, separator)) {
            if (current.length() + part.length() <= maxChars) {
                current.append(part);
                continue;
            }
            if (current.length() > 0) {
                out.add(current.toString());
                current.setLength(0);
            }
            if (part.length() > maxChars) {
                splitRecursively(part, finer, maxChars, out);
            } else {
                current.append(part);
            }
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        int index;
        while ((index = text.indexOf(separator, from)) >= 0) {
            parts.add(text.substring(from, index + separator.length()));
            from = index + separator.length();
        }
        if (from < text.length()) {
            parts.add(text.substring(from));
        }
        return parts;
    }

    private static int overlapStart(String content, int previousEnd, int overlapChars) {
        int start = Math.max(0, previousEnd - overlapChars);
        for (int candidate = start; candidate < previousEnd; candidate++) {
            if (Character.isWhitespace(content.charAt(candidate))) {
                return candidate + 1;
            }
        }
        return start;
    }
}
