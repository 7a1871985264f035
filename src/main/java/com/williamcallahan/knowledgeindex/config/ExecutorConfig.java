package com.williamcallahan.knowledgeindex.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Executors for embedding batches and hybrid search branches.
 */
@Configuration
public class ExecutorConfig {

    private static final int SEARCH_THREADS = 8;

    @Bean(name = "embeddingExecutor", destroyMethod = "shutdown")
    public ExecutorService embeddingExecutor(AppProperties appProperties) {
        int threads = Math.max(1, appProperties.getEmbedding().getParallelBatches());
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("embedding-batch-"));
    }

    /**
     * Runs the vector and keyword branches of hybrid queries; each branch takes its own index session.
     */
    @Bean(name = "searchExecutor", destroyMethod = "shutdown")
    public ExecutorService searchExecutor() {
        return Executors.newFixedThreadPool(SEARCH_THREADS, namedDaemonThreads("search-branch-"));
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger threadNumber = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
