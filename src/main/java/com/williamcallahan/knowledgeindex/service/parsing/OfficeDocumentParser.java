package com.williamcallahan.knowledgeindex.service.parsing;

import com.williamcallahan.knowledgeindex.service.ingestion.IngestionCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts text from Word ({@code .docx}) and PowerPoint ({@code .pptx}) files using Apache POI.
 *
 * <p>Slides are joined with blank lines so each slide starts a new paragraph. Legacy binary formats
 * ({@code .doc}, {@code .ppt}) are not registered.</p>
 */
@Component
public class OfficeDocumentParser implements DocumentParser {
    private static final Logger log = LoggerFactory.getLogger(OfficeDocumentParser.class);

    private static final String WORD_EXTENSION = "docx";
    private static final String SLIDES_EXTENSION = "pptx";
    private static final Set<String> EXTENSIONS = Set.of(WORD_EXTENSION, SLIDES_EXTENSION);

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public ParsedDocument parse(InputStream input, String fileName) {
        String extension = DocumentParserRegistry.extensionOf(fileName);
        try {
            ParsedDocument parsed = SLIDES_EXTENSION.equals(extension.toLowerCase(Locale.ROOT))
                    ? parseSlides(input, fileName)
                    : parseWord(input, fileName);
            log.debug("Extracted {} characters from {}", parsed.content().length(), fileName);
            return parsed;
        } catch (IngestionCancelledException cancelled) {
            throw cancelled;
        } catch (IOException | RuntimeException parseFailure) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IngestionCancelledException("Parsing interrupted for " + fileName, parseFailure);
            }
            return ParsedDocument.failed(
                    "Failed to parse Office document " + fileName + ": " + parseFailure.getMessage());
        }
    }

    private ParsedDocument parseWord(InputStream input, String fileName) throws IOException {
        try (XWPFDocument document = new XWPFDocument(input)) {
            String text = normalize(new XWPFWordExtractor(document).getText());
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("paragraphCount", String.valueOf(document.getParagraphs().size()));
            putCoreProperties(metadata, document.getProperties());
            return withEmptyWarning(text, metadata, fileName);
        }
    }

    private ParsedDocument parseSlides(InputStream input, String fileName) throws IOException {
        try (XMLSlideShow slideShow = new XMLSlideShow(input)) {
            List<String> slideTexts = new ArrayList<>();
            for (XSLFSlide slide : slideShow.getSlides()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IngestionCancelledException("Parsing interrupted for " + fileName);
                }
                List<String> shapeTexts = new ArrayList<>();
                for (XSLFShape shape : slide.getShapes()) {
                    if (shape instanceof XSLFTextShape textShape) {
                        String shapeText = textShape.getText();
                        if (shapeText != null && !shapeText.isBlank()) {
                            shapeTexts.add(shapeText.strip());
                        }
                    }
                }
                if (!shapeTexts.isEmpty()) {
                    slideTexts.add(String.join("\n", shapeTexts));
                }
            }
            String text = normalize(String.join("\n\n", slideTexts));
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("slideCount", String.valueOf(slideShow.getSlides().size()));
            putCoreProperties(metadata, slideShow.getProperties());
            return withEmptyWarning(text, metadata, fileName);
        }
    }

    private static ParsedDocument withEmptyWarning(String text, Map<String, String> metadata, String fileName) {
        List<String> warnings = text.isBlank() ? List.of("No text found in " + fileName) : List.of();
        return new ParsedDocument(text, metadata, warnings);
    }

    private static void putCoreProperties(Map<String, String> metadata, POIXMLProperties properties) {
        if (properties == null || properties.getCoreProperties() == null) {
            return;
        }
        POIXMLProperties.CoreProperties core = properties.getCoreProperties();
        putIfPresent(metadata, "title", core.getTitle());
        putIfPresent(metadata, "author", core.getCreator());
        putIfPresent(metadata, "subject", core.getSubject());
    }

    private static void putIfPresent(Map<String, String> metadata, String key, String value) {
        if (value != null && !value.isBlank()) {
            metadata.put(key, value.trim());
        }
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n').strip();
    }
}
