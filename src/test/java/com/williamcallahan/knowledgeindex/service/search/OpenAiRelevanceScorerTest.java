package com.williamcallahan.knowledgeindex.service.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import org.junit.jupiter.api.Test;

class OpenAiRelevanceScorerTest {

    @Test
    void promptCarriesQueryAndTruncatedPassage() {
        String prompt = OpenAiRelevanceScorer.buildPrompt("key rotation", "x".repeat(5000));

        assertTrue(prompt.contains("Query: key rotation"));
        assertTrue(prompt.endsWith("x".repeat(2000)));
        assertFalse(prompt.contains("x".repeat(2001)));
    }

    @Test
    void providerFailureBecomesRerankingFailure() {
        OpenAIClient client = mock(OpenAIClient.class, RETURNS_DEEP_STUBS);
        when(client.chat().completions().create(any(ChatCompletionCreateParams.class)))
                .thenThrow(new IllegalStateException("503 Service Unavailable"));
        OpenAiRelevanceScorer scorer = new OpenAiRelevanceScorer(client, "gpt-4o-mini", 0.0);

        RerankingFailureException failure =
                assertThrows(RerankingFailureException.class, () -> scorer.score("query", "passage"));

        assertEquals("Relevance scoring call failed", failure.getMessage());
        assertEquals("503 Service Unavailable", failure.getCause().getMessage());
    }
}
