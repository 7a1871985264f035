package com.williamcallahan.knowledgeindex.service.parsing;

import com.williamcallahan.knowledgeindex.service.ingestion.IngestionCancelledException;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

/**
 * Extracts readable text from HTML pages with jsoup, filtering navigation and script noise and keeping
 * block boundaries as paragraph breaks so chunkers can find natural split points.
 */
@Component
public class HtmlDocumentParser implements DocumentParser {

    private static final Set<String> EXTENSIONS = Set.of("html", "htm", "xhtml");

    // CSS selectors for navigation and other non-content elements
    private static final String[] REMOVE_SELECTORS = {
        "nav", "header", "footer", "aside",
        ".navigation", ".nav", ".navbar", ".sidebar", ".toc", ".breadcrumb",
        ".skip-nav", ".skip-link",
        "script", "style", "noscript", "template", "iframe",
        ".copyright", ".legal", "#navigation", "#nav"
    };

    // CSS selectors for main content areas (in priority order)
    private static final String[] CONTENT_SELECTORS = {
        "main", "article", ".content-container", ".main-content", ".documentation", "#content"
    };

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" *\\n *");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    @Override
    public Set<String> supportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public ParsedDocument parse(InputStream input, String fileName) {
        try {
            Document document = Jsoup.parse(input, null, "");
            for (String selector : REMOVE_SELECTORS) {
                document.select(selector).remove();
            }
            Element contentRoot = selectContentRoot(document);
            String text = normalizeWhitespace(extractBlockText(contentRoot));

            Map<String, String> metadata = new LinkedHashMap<>();
            String title = document.title();
            if (title != null && !title.isBlank()) {
                metadata.put("title", title.trim());
            }
            List<String> warnings = text.isBlank() ? List.of("No readable text found in " + fileName) : List.of();
            return new ParsedDocument(text, metadata, warnings);
        } catch (IOException parseFailure) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IngestionCancelledException("Parsing interrupted for " + fileName, parseFailure);
            }
            return ParsedDocument.failed("Failed to parse HTML " + fileName + ": " + parseFailure.getMessage());
        }
    }

    private static Element selectContentRoot(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Element candidate = document.selectFirst(selector);
            if (candidate != null && !candidate.text().isBlank()) {
                return candidate;
            }
        }
        return document.body() == null ? document : document.body();
    }

    private static String extractBlockText(Element root) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    text.append(textNode.text());
                } else if (node instanceof Element element && "br".equals(element.normalName())) {
                    text.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    text.append("\n\n");
                }
            }
        }, root);
        return text.toString();
    }

    private static String normalizeWhitespace(String raw) {
        String collapsed = HORIZONTAL_WHITESPACE.matcher(raw.replace("\r", "")).replaceAll(" ");
        collapsed = SPACE_AROUND_NEWLINE.matcher(collapsed).replaceAll("\n");
        collapsed = EXCESS_NEWLINES.matcher(collapsed).replaceAll("\n\n");
        return collapsed.trim();
    }
}
