package com.williamcallahan.knowledgeindex.store;

import static io.qdrant.client.ConditionFactory.matchKeyword;
import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.ValueFactory.value;
import static io.qdrant.client.VectorsFactory.vectors;
import static io.qdrant.client.WithPayloadSelectorFactory.enable;

import com.williamcallahan.knowledgeindex.domain.document.VectorEntry;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Common.Filter;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vector index backed by a Qdrant collection using cosine distance.
 *
 * <p>Point ids are name-based UUIDs derived from chunk ids; the chunk id, document id, scope id, path and
 * model id travel in the payload. Qdrant reports cosine similarity as the score, which is converted back
 * to a distance so callers see the same metric as every other index.</p>
 */
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    static final String PAYLOAD_CHUNK_ID = "chunkId";
    static final String PAYLOAD_DOCUMENT_ID = "documentId";
    static final String PAYLOAD_SCOPE_ID = "scopeId";
    static final String PAYLOAD_PATH = "path";
    static final String PAYLOAD_MODEL_ID = "modelId";

    private static final int PATH_PREFIX_OVER_FETCH = 4;

    private final QdrantClient qdrantClient;
    private final String collection;
    private final int dimensions;
    private final Duration timeout;

    public QdrantVectorIndex(QdrantClient qdrantClient, String collection, int dimensions, Duration timeout) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    /**
     * Creates the collection when it does not exist yet.
     */
    public void ensureCollection() {
        Boolean exists = QdrantListenableFutureBridge.await(
                qdrantClient.collectionExistsAsync(collection), timeout, "collection check");
        if (Boolean.TRUE.equals(exists)) {
            log.info("[QDRANT] Using existing collection {}", collection);
            return;
        }
        VectorParams vectorParams = VectorParams.newBuilder()
                .setSize(dimensions)
                .setDistance(Distance.Cosine)
                .build();
        QdrantListenableFutureBridge.await(
                qdrantClient.createCollectionAsync(collection, vectorParams), timeout, "collection create");
        log.info("[QDRANT] Created collection {} (dimensions={})", collection, dimensions);
    }

    @Override
    public void upsert(List<VectorEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return;
        }
        List<PointStruct> points = new ArrayList<>(entries.size());
        for (VectorEntry entry : entries) {
            if (entry.vector().length != dimensions) {
                throw new IllegalArgumentException("Vector dimension mismatch for chunk " + entry.chunkId()
                        + ": expected " + dimensions + " but received " + entry.vector().length);
            }
            points.add(PointStruct.newBuilder()
                    .setId(id(pointIdFor(entry.chunkId())))
                    .setVectors(vectors(entry.vector()))
                    .putAllPayload(payloadFor(entry))
                    .build());
        }
        QdrantListenableFutureBridge.await(qdrantClient.upsertAsync(collection, points), timeout, "upsert");
        log.debug("[QDRANT] Upserted {} points into {}", points.size(), collection);
    }

    @Override
    public List<VectorMatch> search(float[] queryVector, int topK, SearchFilter filter) {
        if (topK <= 0) {
            return List.of();
        }
        List<Float> queryValues = new ArrayList<>(queryVector.length);
        for (float component : queryVector) {
            queryValues.add(component);
        }
        int limit = filter.hasPathPrefix() ? topK * PATH_PREFIX_OVER_FETCH : topK;
        SearchPoints request = SearchPoints.newBuilder()
                .setCollectionName(collection)
                .addAllVector(queryValues)
                .setFilter(scopeFilter(filter.scopeId()))
                .setLimit(limit)
                .setWithPayload(enable(true))
                .build();
        List<ScoredPoint> points =
                QdrantListenableFutureBridge.await(qdrantClient.searchAsync(request), timeout, "search");

        List<VectorMatch> matches = new ArrayList<>(Math.min(points.size(), topK));
        for (ScoredPoint point : points) {
            Map<String, Value> payload = point.getPayloadMap();
            if (!filter.matches(payloadString(payload, PAYLOAD_SCOPE_ID), payloadString(payload, PAYLOAD_PATH))) {
                continue;
            }
            matches.add(new VectorMatch(
                    payloadString(payload, PAYLOAD_CHUNK_ID),
                    payloadString(payload, PAYLOAD_DOCUMENT_ID),
                    1.0 - point.getScore()));
            if (matches.size() == topK) {
                break;
            }
        }
        return List.copyOf(matches);
    }

    @Override
    public void deleteByDocumentId(String documentId) {
        QdrantListenableFutureBridge.await(
                qdrantClient.deleteAsync(collection, documentFilter(documentId)), timeout, "delete");
        log.debug("[QDRANT] Deleted points of document {}", documentId);
    }

    @Override
    public long countByDocumentId(String documentId) {
        Long count = QdrantListenableFutureBridge.await(
                qdrantClient.countAsync(collection, documentFilter(documentId), true), timeout, "count");
        return count == null ? 0L : count;
    }

    static UUID pointIdFor(String chunkId) {
        return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Value> payloadFor(VectorEntry entry) {
        Map<String, Value> payload = new HashMap<>();
        payload.put(PAYLOAD_CHUNK_ID, value(entry.chunkId()));
        payload.put(PAYLOAD_DOCUMENT_ID, value(entry.documentId()));
        payload.put(PAYLOAD_SCOPE_ID, value(entry.scopeId()));
        payload.put(PAYLOAD_PATH, value(entry.path()));
        payload.put(PAYLOAD_MODEL_ID, value(entry.modelId()));
        return payload;
    }

    private static Filter scopeFilter(String scopeId) {
        return Filter.newBuilder().addMust(matchKeyword(PAYLOAD_SCOPE_ID, scopeId)).build();
    }

    private static Filter documentFilter(String documentId) {
        return Filter.newBuilder().addMust(matchKeyword(PAYLOAD_DOCUMENT_ID, documentId)).build();
    }

    private static String payloadString(Map<String, Value> payload, String key) {
        Value payloadValue = payload.get(key);
        if (payloadValue == null || payloadValue.getKindCase() != Value.KindCase.STRING_VALUE) {
            return "";
        }
        return payloadValue.getStringValue();
    }
}
