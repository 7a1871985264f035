package com.williamcallahan.knowledgeindex.service.embedding;

/**
 * Vector helpers shared by the in-memory index and the semantic chunker.
 */
public final class VectorMath {

    private VectorMath() {}

    /**
     * Cosine similarity of two equal-length vectors; 0 when either vector has zero norm.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
