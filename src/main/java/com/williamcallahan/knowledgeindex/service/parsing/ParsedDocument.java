package com.williamcallahan.knowledgeindex.service.parsing;

import java.util.List;
import java.util.Map;

/**
 * Text and metadata extracted from a source file.
 *
 * @param content extracted text, empty when nothing could be extracted
 * @param metadata parser-specific metadata such as title or page count
 * @param warnings recoverable problems encountered while parsing
 */
public record ParsedDocument(String content, Map<String, String> metadata, List<String> warnings) {

    public ParsedDocument {
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ParsedDocument of(String content) {
        return new ParsedDocument(content, Map.of(), List.of());
    }

    /**
     * Returns an empty document carrying a single warning.
     */
    public static ParsedDocument failed(String warning) {
        return new ParsedDocument("", Map.of(), List.of(warning));
    }

    public boolean hasContent() {
        return !content.isBlank();
    }
}
