package com.williamcallahan.knowledgeindex.service.parsing;

import com.williamcallahan.knowledgeindex.service.ingestion.IngestionCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reads plain-text formats as UTF-8, dropping a byte order mark and normalizing line endings.
 */
@Component
public class TextDocumentParser implements DocumentParser {

    private static final Set<String> EXTENSIONS =
            Set.of("txt", "md", "markdown", "csv", "json", "xml", "yaml", "yml", "log");
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public ParsedDocument parse(InputStream input, String fileName) {
        try {
            String text = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                text = text.substring(1);
            }
            text = text.replace("\r\n", "\n").replace('\r', '\n');
            List<String> warnings = text.isBlank() ? List.of("File is empty: " + fileName) : List.of();
            return new ParsedDocument(text, Map.of("lineCount", String.valueOf(text.lines().count())), warnings);
        } catch (IOException readFailure) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IngestionCancelledException("Parsing interrupted for " + fileName, readFailure);
            }
            return ParsedDocument.failed("Failed to read " + fileName + ": " + readFailure.getMessage());
        }
    }
}
