package com.williamcallahan.knowledgeindex.service.parsing;

import java.io.InputStream;
import java.util.Set;

/**
 * Extracts text from one family of file types.
 *
 * <p>Implementations never throw for recoverable problems; they return empty content with warnings.
 * {@link com.williamcallahan.knowledgeindex.service.ingestion.IngestionCancelledException} and thread
 * interruption are the exception and must propagate.</p>
 */
public interface DocumentParser {

    /**
     * Lower-case file extensions without the leading dot.
     */
    Set<String> supportedExtensions();

    ParsedDocument parse(InputStream input, String fileName);
}
