package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.store.ChunkStore;
import com.williamcallahan.knowledgeindex.store.ContentStore;
import com.williamcallahan.knowledgeindex.store.DocumentStore;
import com.williamcallahan.knowledgeindex.store.InMemoryChunkStore;
import com.williamcallahan.knowledgeindex.store.InMemoryDocumentStore;
import com.williamcallahan.knowledgeindex.store.InMemoryVectorIndex;
import com.williamcallahan.knowledgeindex.store.LocalContentStore;
import com.williamcallahan.knowledgeindex.store.LuceneKeywordIndex;
import com.williamcallahan.knowledgeindex.store.VectorIndex;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Store adapters. Qdrant replaces the in-memory vector index when {@code app.qdrant.enabled=true}.
 */
@Configuration
public class StorageConfig {
    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    public ChunkStore chunkStore() {
        return new InMemoryChunkStore();
    }

    @Bean
    public ContentStore contentStore(AppProperties appProperties) {
        Path contentRoot = Path.of(appProperties.getStorage().getContentRoot());
        log.info("Storing original documents under {}", contentRoot.toAbsolutePath());
        return new LocalContentStore(contentRoot);
    }

    /**
     * Lucene keyword index, on disk when {@code app.storage.keyword-index-dir} is set.
     */
    @Bean(destroyMethod = "close")
    public LuceneKeywordIndex keywordIndex(AppProperties appProperties) {
        String indexDir = appProperties.getStorage().getKeywordIndexDir();
        if (indexDir.isBlank()) {
            log.info("[LUCENE] Using in-memory keyword index");
            return LuceneKeywordIndex.inMemory();
        }
        log.info("[LUCENE] Using keyword index at {}", indexDir);
        return LuceneKeywordIndex.onDisk(Path.of(indexDir));
    }

    @Bean
    @ConditionalOnProperty(name = "app.qdrant.enabled", havingValue = "false", matchIfMissing = true)
    public VectorIndex inMemoryVectorIndex(AppProperties appProperties) {
        return new InMemoryVectorIndex(appProperties.getEmbedding().getDimensions());
    }
}
