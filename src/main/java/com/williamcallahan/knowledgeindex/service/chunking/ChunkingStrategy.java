package com.williamcallahan.knowledgeindex.service.chunking;

import com.williamcallahan.knowledgeindex.config.ChunkingSettings;
import com.williamcallahan.knowledgeindex.service.parsing.ParsedDocument;
import java.util.List;

/**
 * Splits parsed text into ordered, token-bounded chunks.
 */
public interface ChunkingStrategy {

    String METADATA_STRATEGY = "ChunkingStrategy";

    /**
     * Name used for configuration lookup and provenance, e.g. {@code FixedSize}.
     */
    String name();

    /**
     * Splits the document's content. Returns an empty list for blank content.
     */
    List<ChunkDraft> chunk(ParsedDocument document, ChunkingSettings settings);
}
