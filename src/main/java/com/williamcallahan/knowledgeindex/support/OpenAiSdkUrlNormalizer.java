package com.williamcallahan.knowledgeindex.support;

/**
 * Normalizes base URLs for the OpenAI Java SDK.
 *
 * <p>The SDK expects base URLs to end with the API version prefix ({@code /v1}). Operators often paste the
 * full endpoint instead ({@code .../v1/embeddings}, {@code .../v1/chat/completions}); those suffixes are
 * stripped.</p>
 */
public final class OpenAiSdkUrlNormalizer {

    private static final String[] ENDPOINT_SUFFIXES = {"/embeddings", "/chat/completions"};

    private OpenAiSdkUrlNormalizer() {}

    /**
     * Normalizes a base URL for the OpenAI Java SDK.
     *
     * @param baseUrl raw base URL from configuration
     * @return normalized URL suitable for OpenAIOkHttpClient.builder().baseUrl()
     * @throws IllegalStateException if baseUrl is null or blank
     */
    public static String normalize(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("OpenAI SDK base URL is not configured");
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        for (String endpointSuffix : ENDPOINT_SUFFIXES) {
            if (trimmed.endsWith(endpointSuffix)) {
                trimmed = trimmed.substring(0, trimmed.length() - endpointSuffix.length());
                break;
            }
        }
        if (trimmed.endsWith("/v1")) {
            return trimmed;
        }
        return trimmed + "/v1";
    }
}
