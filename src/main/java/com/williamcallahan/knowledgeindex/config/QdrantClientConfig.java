package com.williamcallahan.knowledgeindex.config;

import com.williamcallahan.knowledgeindex.store.QdrantVectorIndex;
import com.williamcallahan.knowledgeindex.store.VectorIndex;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Qdrant client with gRPC keepalive, and the vector index built on it.
 *
 * <p>Keepalive keeps long-lived channels from being dropped by load balancers in front of hosted Qdrant.</p>
 */
@Configuration
@ConditionalOnProperty(name = "app.qdrant.enabled", havingValue = "true")
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    /** Keepalive ping interval in seconds. */
    private static final long KEEPALIVE_TIME_SECONDS = 30;
    /** Keepalive timeout before connection is considered dead. */
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    /** Idle timeout before keepalive pings start. */
    private static final long IDLE_TIMEOUT_MINUTES = 5;

    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient(AppProperties appProperties) {
        AppProperties.Qdrant qdrant = appProperties.getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={})", qdrant.getHost(), qdrant.getPort(), qdrant.isUseTls());

        ManagedChannelBuilder<?> channelBuilder = ManagedChannelBuilder.forAddress(qdrant.getHost(), qdrant.getPort());
        if (qdrant.isUseTls()) {
            channelBuilder.useTransportSecurity();
        } else {
            channelBuilder.usePlaintext();
        }
        channelBuilder
                .keepAliveTime(KEEPALIVE_TIME_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);

        ManagedChannel channel = Objects.requireNonNull(channelBuilder.build(), "ManagedChannel");
        QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient.newBuilder(channel, true);
        if (!qdrant.getApiKey().isBlank()) {
            grpcClientBuilder.withApiKey(qdrant.getApiKey());
        }
        return new QdrantClient(Objects.requireNonNull(grpcClientBuilder.build(), "QdrantGrpcClient"));
    }

    /**
     * Vector index over the configured collection, created on startup when missing.
     */
    @Bean
    public VectorIndex qdrantVectorIndex(QdrantClient qdrantClient, AppProperties appProperties) {
        AppProperties.Qdrant qdrant = appProperties.getQdrant();
        QdrantVectorIndex vectorIndex = new QdrantVectorIndex(
                qdrantClient, qdrant.getCollection(), appProperties.getEmbedding().getDimensions(), qdrant.getTimeout());
        vectorIndex.ensureCollection();
        return vectorIndex;
    }
}
