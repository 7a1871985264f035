package com.williamcallahan.knowledgeindex.service.parsing;

import java.io.InputStream;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the parser for a file by its extension.
 */
@Component
public class DocumentParserRegistry {
    private static final Logger log = LoggerFactory.getLogger(DocumentParserRegistry.class);

    private final Map<String, DocumentParser> parsersByExtension = new HashMap<>();

    public DocumentParserRegistry(List<DocumentParser> parsers) {
        for (DocumentParser parser : parsers) {
            for (String extension : parser.supportedExtensions()) {
                DocumentParser previous = parsersByExtension.put(extension.toLowerCase(Locale.ROOT), parser);
                if (previous != null && previous != parser) {
                    log.warn("Extension .{} claimed by both {} and {}; using the latter",
                            extension, previous.getClass().getSimpleName(), parser.getClass().getSimpleName());
                }
            }
        }
    }

    public Optional<DocumentParser> forFileName(String fileName) {
        return Optional.ofNullable(parsersByExtension.get(extensionOf(fileName)));
    }

    public Set<String> supportedExtensions() {
        return Set.copyOf(parsersByExtension.keySet());
    }

    /**
     * Parses with the matching parser, or returns empty content and a warning for unsupported types.
     */
    public ParsedDocument parse(InputStream input, String fileName) {
        Optional<DocumentParser> parser = forFileName(fileName);
        if (parser.isEmpty()) {
            String extension = extensionOf(fileName);
            log.warn("[INDEXING] Unsupported file type .{}", extension);
            return ParsedDocument.failed("Unsupported file type: ." + extension);
        }
        return parser.get().parse(input, fileName);
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String baseName = fileName.substring(slash + 1);
        int dot = baseName.lastIndexOf('.');
        if (dot < 0 || dot == baseName.length() - 1) {
            return "";
        }
        return baseName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
