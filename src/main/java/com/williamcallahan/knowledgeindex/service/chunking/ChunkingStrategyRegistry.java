package com.williamcallahan.knowledgeindex.service.chunking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves chunking strategies by name, falling back to {@link FixedSizeChunkingStrategy} for unknown names.
 */
@Component
public class ChunkingStrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChunkingStrategyRegistry.class);

    private final Map<String, ChunkingStrategy> strategiesByName = new LinkedHashMap<>();

    public ChunkingStrategyRegistry(List<ChunkingStrategy> strategies) {
        for (ChunkingStrategy strategy : strategies) {
            strategiesByName.put(strategy.name().toLowerCase(Locale.ROOT), strategy);
        }
        if (!strategiesByName.containsKey(FixedSizeChunkingStrategy.NAME.toLowerCase(Locale.ROOT))) {
            strategiesByName.put(FixedSizeChunkingStrategy.NAME.toLowerCase(Locale.ROOT), new FixedSizeChunkingStrategy());
        }
    }

    public ChunkingStrategy resolve(String name) {
        if (name != null) {
            ChunkingStrategy strategy = strategiesByName.get(name.trim().toLowerCase(Locale.ROOT));
            if (strategy != null) {
                return strategy;
            }
        }
        log.warn("[CHUNKING] Unknown chunking strategy '{}', using {}", name, FixedSizeChunkingStrategy.NAME);
        return strategiesByName.get(FixedSizeChunkingStrategy.NAME.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Set.copyOf(strategiesByName.keySet());
    }
}
