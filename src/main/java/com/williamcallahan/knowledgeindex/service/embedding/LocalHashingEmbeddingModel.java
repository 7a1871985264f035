package com.williamcallahan.knowledgeindex.service.embedding;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.util.StringHelper;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

/**
 * CPU-only deterministic embedding built from hashed lexical features, so indexing and search work
 * without a remote provider.
 *
 * <p>Tokens from Lucene's standard analyzer are feature-hashed with Murmur3 into {@code dim} signed buckets
 * and the result is L2-normalized. Texts sharing vocabulary land close together; there is no deeper
 * semantics.</p>
 */
public class LocalHashingEmbeddingModel implements EmbeddingModel {
    private static final String TOKEN_STREAM_FIELD = "embedding_text";
    private static final int SIGN_SEED = 0x9747b28c;

    private final int dim;

    public LocalHashingEmbeddingModel(int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Embedding dimensions must be positive");
        }
        this.dim = dim;
    }

    @Override
    public EmbeddingResponse call(EmbeddingRequest request) {
        List<String> inputs = request.getInstructions();
        List<Embedding> list = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            list.add(new Embedding(embed(inputs.get(i)), i));
        }
        return new EmbeddingResponse(list);
    }

    @Override
    public float[] embed(String text) {
        return hashToVector(text == null ? "" : text);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(embed(t));
        return out;
    }

    @Override
    public float[] embed(Document document) {
        return embed(document.getText());
    }

    @Override
    public int dimensions() { return dim; }

    private float[] hashToVector(String text) {
        double[] accumulator = new double[dim];
        try (StandardAnalyzer analyzer = new StandardAnalyzer();
                TokenStream tokenStream = analyzer.tokenStream(TOKEN_STREAM_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                byte[] tokenBytes = termAttribute.toString().getBytes(StandardCharsets.UTF_8);
                int bucketHash = StringHelper.murmurhash3_x86_32(tokenBytes, 0, tokenBytes.length, 0);
                int signHash = StringHelper.murmurhash3_x86_32(tokenBytes, 0, tokenBytes.length, SIGN_SEED);
                int bucket = Math.floorMod(bucketHash, dim);
                accumulator[bucket] += (signHash & 1) == 0 ? 1.0 : -1.0;
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new UncheckedIOException("Failed to tokenize text for hashing embedding", ioException);
        }

        double norm = 0.0;
        for (double component : accumulator) {
            norm += component * component;
        }
        norm = Math.sqrt(norm);
        float[] vector = new float[dim];
        if (norm == 0.0) {
            return vector;
        }
        for (int i = 0; i < dim; i++) {
            vector[i] = (float) (accumulator[i] / norm);
        }
        return vector;
    }
}
