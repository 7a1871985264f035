package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.domain.search.SearchMode;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 *
 * <p>Instances are mutable so Spring can bind them; operations never read these directly while running.
 * They capture an immutable snapshot ({@link ChunkingSettings}, {@link EmbeddingSettings},
 * {@link SearchSettings}) when they start.</p>
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Search search = new Search();
    private CrossEncoder crossEncoder = new CrossEncoder();
    private Ingestion ingestion = new Ingestion();
    private Storage storage = new Storage();
    private Qdrant qdrant = new Qdrant();

    public Chunking getChunking() {
        return chunking;
    }

    public void setChunking(Chunking chunking) {
        this.chunking = chunking;
    }

    public Embedding getEmbedding() {
        return embedding;
    }

    public void setEmbedding(Embedding embedding) {
        this.embedding = embedding;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public CrossEncoder getCrossEncoder() {
        return crossEncoder;
    }

    public void setCrossEncoder(CrossEncoder crossEncoder) {
        this.crossEncoder = crossEncoder;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Qdrant getQdrant() {
        return qdrant;
    }

    public void setQdrant(Qdrant qdrant) {
        this.qdrant = qdrant;
    }

    public static class Chunking {
        private String strategy = "Semantic";
        private int maxChunkSize = 512;
        private int overlap = 50;
        private int minChunkSize = 10;
        private double semanticThreshold = 0.5;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public int getMaxChunkSize() { return maxChunkSize; }
        public void setMaxChunkSize(int maxChunkSize) { this.maxChunkSize = maxChunkSize; }

        public int getOverlap() { return overlap; }
        public void setOverlap(int overlap) { this.overlap = overlap; }

        public int getMinChunkSize() { return minChunkSize; }
        public void setMinChunkSize(int minChunkSize) { this.minChunkSize = minChunkSize; }

        public double getSemanticThreshold() { return semanticThreshold; }
        public void setSemanticThreshold(double semanticThreshold) { this.semanticThreshold = semanticThreshold; }
    }

    public static class Embedding {
        private String provider = "local-hash";
        private String model = "nomic-embed-text";
        private int dimensions = 768;
        private int batchSize = 32;
        private int parallelBatches = 4;
        private String baseUrl = "";
        private String apiKey = "";

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getDimensions() { return dimensions; }
        public void setDimensions(int dimensions) { this.dimensions = dimensions; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getParallelBatches() { return parallelBatches; }
        public void setParallelBatches(int parallelBatches) { this.parallelBatches = parallelBatches; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl == null ? "" : baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey == null ? "" : apiKey; }
    }

    public static class Search {
        private SearchMode mode = SearchMode.HYBRID;
        private int topK = 10;
        private double minScore = 0.0;
        private String reranker = "RRF";
        private int rrfK = 60;
        private int overFetchFactor = 3;
        private Duration branchTimeout = Duration.ofSeconds(10);
        private boolean failOnPartialSearchError = false;

        public SearchMode getMode() { return mode; }
        public void setMode(SearchMode mode) { this.mode = mode; }

        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }

        public double getMinScore() { return minScore; }
        public void setMinScore(double minScore) { this.minScore = minScore; }

        public String getReranker() { return reranker; }
        public void setReranker(String reranker) { this.reranker = reranker; }

        public int getRrfK() { return rrfK; }
        public void setRrfK(int rrfK) { this.rrfK = rrfK; }

        public int getOverFetchFactor() { return overFetchFactor; }
        public void setOverFetchFactor(int overFetchFactor) { this.overFetchFactor = overFetchFactor; }

        public Duration getBranchTimeout() { return branchTimeout; }
        public void setBranchTimeout(Duration branchTimeout) { this.branchTimeout = branchTimeout; }

        public boolean isFailOnPartialSearchError() { return failOnPartialSearchError; }
        public void setFailOnPartialSearchError(boolean failOnPartialSearchError) {
            this.failOnPartialSearchError = failOnPartialSearchError;
        }
    }

    public static class CrossEncoder {
        private boolean enabled = false;
        private String baseUrl = "";
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private double temperature = 0.1;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl == null ? "" : baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey == null ? "" : apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }

    public static class Ingestion {
        private int queueCapacity = 1000;
        private int workerCount = 2;
        private Duration enqueueTimeout = Duration.ofSeconds(2);
        private Duration statusRetention = Duration.ofHours(1);
        private Duration progressInterval = Duration.ofSeconds(2);
        private Duration shutdownGrace = Duration.ofSeconds(10);

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public int getWorkerCount() { return workerCount; }
        public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

        public Duration getEnqueueTimeout() { return enqueueTimeout; }
        public void setEnqueueTimeout(Duration enqueueTimeout) { this.enqueueTimeout = enqueueTimeout; }

        public Duration getStatusRetention() { return statusRetention; }
        public void setStatusRetention(Duration statusRetention) { this.statusRetention = statusRetention; }

        public Duration getProgressInterval() { return progressInterval; }
        public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }

        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    }

    public static class Storage {
        private String contentRoot = "data/content";
        private String keywordIndexDir = "";

        public String getContentRoot() { return contentRoot; }
        public void setContentRoot(String contentRoot) { this.contentRoot = contentRoot; }

        public String getKeywordIndexDir() { return keywordIndexDir; }
        public void setKeywordIndexDir(String keywordIndexDir) {
            this.keywordIndexDir = keywordIndexDir == null ? "" : keywordIndexDir;
        }
    }

    public static class Qdrant {
        private boolean enabled = false;
        private String host = "localhost";
        private int port = 6334;
        private boolean useTls = false;
        private String apiKey = "";
        private String collection = "knowledge_chunks";
        private Duration timeout = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public boolean isUseTls() { return useTls; }
        public void setUseTls(boolean useTls) { this.useTls = useTls; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey == null ? "" : apiKey; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
