package com.williamcallahan.knowledgeindex;

import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.knowledgeindex.service.ingestion.IngestionWorkerPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.embedding.provider=local-hash",
        "app.embedding.dimensions=64",
        "app.qdrant.enabled=false",
        "app.storage.content-root=target/test-content",
        "app.storage.keyword-index-dir="
})
class KnowledgeIndexApplicationTests {

    @Autowired
    IngestionWorkerPool ingestionWorkerPool;

    @Test
    void contextLoads() {
        assertTrue(ingestionWorkerPool.isRunning());
    }

}
