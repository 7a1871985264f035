package com.williamcallahan.knowledgeindex.service.embedding;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIRetryableException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.williamcallahan.knowledgeindex.support.OpenAiSdkUrlNormalizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAI-compatible embedding client (OpenAI, Ollama, LM Studio and similar `/v1/embeddings` servers).
 *
 * <p>Retries rate limits and server errors with exponential backoff, then fails with
 * {@link EmbeddingServiceUnavailableException}. Vectors are reordered by the response index.</p>
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleEmbeddingClient.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 10;
    private static final int READ_TIMEOUT_SECONDS = 60;
    private static final int MAX_ERROR_SNIPPET = 512;
    private static final int MAX_EMBED_ATTEMPTS = 3;
    private static final long INITIAL_RETRY_BACKOFF_MILLIS = 500L;

    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private final OpenAIClient client;
    private final String modelName;
    private final int dimensions;

    /**
     * Creates a client for the endpoint at {@code baseUrl}.
     *
     * @param baseUrl base URL of the OpenAI-compatible API
     * @param apiKey API key; local servers accept any non-blank value
     * @param modelName embedding model identifier
     * @param dimensions expected embedding dimensions
     * @return embedding client configured for the endpoint
     */
    public static OpenAiCompatibleEmbeddingClient create(
            String baseUrl, String apiKey, String modelName, int dimensions) {
        validateDimensions(dimensions);
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey == null || apiKey.isBlank() ? "unused" : apiKey)
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(baseUrl))
                .build();
        return new OpenAiCompatibleEmbeddingClient(client, requireConfiguredModel(modelName), dimensions);
    }

    static OpenAiCompatibleEmbeddingClient create(OpenAIClient client, String modelName, int dimensions) {
        validateDimensions(dimensions);
        return new OpenAiCompatibleEmbeddingClient(
                Objects.requireNonNull(client, "client"), requireConfiguredModel(modelName), dimensions);
    }

    private OpenAiCompatibleEmbeddingClient(OpenAIClient client, String modelName, int dimensions) {
        this.client = client;
        this.modelName = modelName;
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        EmbeddingCreateParams params = EmbeddingCreateParams.builder()
                .model(modelName)
                .inputOfArrayOfStrings(texts)
                .build();

        for (int attemptNumber = 1; ; attemptNumber++) {
            try {
                CreateEmbeddingResponse response = client.embeddings().create(params, requestOptions());
                return parseResponse(response, texts.size());
            } catch (OpenAIServiceException | OpenAIRetryableException providerFailure) {
                if (attemptNumber >= MAX_EMBED_ATTEMPTS || !isRetryable(providerFailure)) {
                    throw new EmbeddingServiceUnavailableException("Remote embedding call failed after "
                            + attemptNumber + " attempt(s): " + sanitizeMessage(providerFailure.getMessage()),
                            providerFailure);
                }
                long backoffMillis = INITIAL_RETRY_BACKOFF_MILLIS * (1L << (attemptNumber - 1));
                log.warn("[EMBEDDING] {} on attempt {}/{}; retrying in {}ms",
                        providerFailure.getClass().getSimpleName(), attemptNumber, MAX_EMBED_ATTEMPTS, backoffMillis);
                sleepBeforeRetry(backoffMillis);
            }
        }
    }

    private static boolean isRetryable(RuntimeException providerFailure) {
        if (providerFailure instanceof OpenAIServiceException serviceException) {
            int statusCode = serviceException.statusCode();
            return statusCode == HTTP_TOO_MANY_REQUESTS
                    || statusCode == HTTP_REQUEST_TIMEOUT
                    || statusCode >= HTTP_INTERNAL_SERVER_ERROR;
        }
        return true;
    }

    private static RequestOptions requestOptions() {
        Duration requestTimeout = Duration.ofSeconds(READ_TIMEOUT_SECONDS);
        return RequestOptions.builder()
                .timeout(Timeout.builder()
                        .connect(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                        .request(requestTimeout)
                        .read(requestTimeout)
                        .build())
                .build();
    }

    private List<float[]> parseResponse(CreateEmbeddingResponse response, int expectedCount) {
        if (response == null || response.data().isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Remote embedding response missing embedding entries");
        }
        float[][] embeddingsByIndex = new float[expectedCount][];
        List<com.openai.models.embeddings.Embedding> entries = response.data();
        for (int position = 0; position < entries.size(); position++) {
            com.openai.models.embeddings.Embedding entry = entries.get(position);
            long responseIndex = entry.index();
            if (responseIndex < 0 || responseIndex >= expectedCount) {
                log.debug("[EMBEDDING] Ignoring embedding index={} (expectedCount={})", responseIndex, expectedCount);
                continue;
            }
            embeddingsByIndex[(int) responseIndex] = toFloatVector(entry.embedding());
        }

        List<float[]> orderedEmbeddings = new ArrayList<>(expectedCount);
        for (int index = 0; index < expectedCount; index++) {
            if (embeddingsByIndex[index] == null) {
                throw new EmbeddingServiceUnavailableException(
                        "Remote embedding response missing embedding for index " + index);
            }
            orderedEmbeddings.add(embeddingsByIndex[index]);
        }
        return List.copyOf(orderedEmbeddings);
    }

    private float[] toFloatVector(List<Float> values) {
        if (values == null || values.size() != dimensions) {
            throw new EmbeddingServiceUnavailableException("Remote embedding dimension mismatch: expected "
                    + dimensions + " but received " + (values == null ? 0 : values.size()));
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < values.size(); i++) {
            Float component = values.get(i);
            if (component == null) {
                throw new EmbeddingServiceUnavailableException("Remote embedding contained null value at index " + i);
            }
            vector[i] = component;
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return modelName;
    }

    /**
     * Closes the underlying OpenAI client and releases its resources.
     */
    @Override
    public void close() {
        client.close();
    }

    private static void sleepBeforeRetry(long retryBackoffMillis) {
        try {
            Thread.sleep(retryBackoffMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            throw new EmbeddingServiceUnavailableException("Embedding retry interrupted", interruptedException);
        }
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "no details";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        return sanitized.length() > MAX_ERROR_SNIPPET ? sanitized.substring(0, MAX_ERROR_SNIPPET) + "..." : sanitized;
    }

    private static String requireConfiguredModel(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalStateException("Embedding model is not configured");
        }
        return modelName;
    }

    private static void validateDimensions(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
    }
}
