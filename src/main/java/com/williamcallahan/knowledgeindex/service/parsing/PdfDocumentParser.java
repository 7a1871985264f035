package com.williamcallahan.knowledgeindex.service.parsing;

import com.williamcallahan.knowledgeindex.service.ingestion.IngestionCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts text and basic metadata from PDF documents using Apache PDFBox.
 *
 * <p>Pages are extracted one at a time and joined with blank lines so page breaks act as paragraph
 * boundaries. Scanned PDFs without a text layer yield empty content and a warning.</p>
 */
@Component
public class PdfDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(PdfDocumentParser.class);

    private static final Set<String> EXTENSIONS = Set.of("pdf");

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public ParsedDocument parse(InputStream input, String fileName) {
        try (PDDocument document = Loader.loadPDF(input.readAllBytes())) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<String> pageTexts = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IngestionCancelledException("Parsing interrupted for " + fileName);
                }
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String pageText = stripper.getText(document);
                if (pageText != null && !pageText.isBlank()) {
                    pageTexts.add(pageText.strip());
                }
            }
            String text = String.join("\n\n", pageTexts);

            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("pageCount", String.valueOf(pageCount));
            PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                putIfPresent(metadata, "title", info.getTitle());
                putIfPresent(metadata, "author", info.getAuthor());
                putIfPresent(metadata, "subject", info.getSubject());
            }

            log.debug("Extracted {} characters from {} PDF pages", text.length(), pageCount);
            List<String> warnings = text.isBlank()
                    ? List.of("No text layer found in " + fileName + "; scanned pages are not supported")
                    : List.of();
            return new ParsedDocument(text, metadata, warnings);
        } catch (IOException parseFailure) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IngestionCancelledException("Parsing interrupted for " + fileName, parseFailure);
            }
            return ParsedDocument.failed("Failed to parse PDF " + fileName + ": " + parseFailure.getMessage());
        }
    }

    private static void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value.trim());
        }
    }
}
