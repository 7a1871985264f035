package com.williamcallahan.knowledgeindex.service.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves rerankers by case-insensitive name, falling back to {@link RrfReranker}.
 */
@Component
public class SearchRerankerRegistry {
    private static final Logger log = LoggerFactory.getLogger(SearchRerankerRegistry.class);

    private final Map<String, SearchReranker> rerankersByName = new LinkedHashMap<>();
    private final SearchReranker fallback;

    public SearchRerankerRegistry(List<SearchReranker> rerankers) {
        for (SearchReranker reranker : rerankers) {
            rerankersByName.put(reranker.name().toLowerCase(Locale.ROOT), reranker);
        }
        this.fallback = rerankersByName.computeIfAbsent(RrfReranker.NAME.toLowerCase(Locale.ROOT), ignored -> new RrfReranker());
    }

    public SearchReranker resolve(String name) {
        if (name != null && !name.isBlank()) {
            SearchReranker reranker = rerankersByName.get(name.trim().toLowerCase(Locale.ROOT));
            if (reranker != null) {
                return reranker;
            }
            log.warn("[SEARCH] Unknown reranker '{}', using {}", name, RrfReranker.NAME);
        }
        return fallback;
    }

    public SearchReranker fallback() {
        return fallback;
    }

    public Set<String> names() {
        return Set.copyOf(rerankersByName.keySet());
    }
}
