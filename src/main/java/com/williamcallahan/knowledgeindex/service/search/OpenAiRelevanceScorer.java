package com.williamcallahan.knowledgeindex.service.search;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.knowledgeindex.support.OpenAiSdkUrlNormalizer;
import java.time.Duration;
import java.util.Objects;

/**
 * Rates query/passage relevance with an OpenAI-compatible chat completion endpoint.
 */
public class OpenAiRelevanceScorer implements RelevanceScorer, AutoCloseable {

    private static final int MAX_PASSAGE_CHARS = 2000;

    private final OpenAIClient client;
    private final String model;
    private final double temperature;

    OpenAiRelevanceScorer(OpenAIClient client, String model, double temperature) {
        this.client = Objects.requireNonNull(client, "client");
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
    }

    public static OpenAiRelevanceScorer create(String baseUrl, String apiKey, String model, double temperature) {
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(baseUrl))
                .timeout(Duration.ofSeconds(30))
                .build();
        return new OpenAiRelevanceScorer(client, model, temperature);
    }

    @Override
    public String score(String query, String passage) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .addUserMessage(buildPrompt(query, passage))
                .model(model)
                .temperature(temperature)
                .build();
        try {
            ChatCompletion completion = client.chat().completions().create(params);
            return completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElse("");
        } catch (RuntimeException callFailure) {
            throw new RerankingFailureException("Relevance scoring call failed", callFailure);
        }
    }

    static String buildPrompt(String query, String passage) {
        String safePassage = passage == null ? "" : passage;
        if (safePassage.length() > MAX_PASSAGE_CHARS) {
            safePassage = safePassage.substring(0, MAX_PASSAGE_CHARS);
        }
        return "Rate how relevant the passage is to the query on a scale from 0 (irrelevant) to 10 (fully answers it).\n"
                + "Reply with the number only.\n\n"
                + "Query: " + query + "\n\n"
                + "Passage:\n" + safePassage;
    }

    @Override
    public void close() {
        client.close();
    }
}
