package io.reviewmind.core.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline embedder: hashes identifier-like tokens into a fixed number of buckets and
 * L2-normalizes the counts. Texts sharing vocabulary land close together, identical texts
 * map to identical vectors.
 */
public final class HashingEmbeddingClient implements EmbeddingClient {
    private static final Logger LOG = LoggerFactory.getLogger(HashingEmbeddingClient.class);

    private final int dimension;

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        LOG.debug("Using hashing embeddings with {} dimensions", dimension);
    }

    @Override
    public String name() {
        return "hashing";
    }

    @Override
    public float[] embed(String text) {
        double[] counts = new double[dimension];
        for (String token : tokenize(text)) {
            counts[Math.floorMod(token.hashCode(), dimension)] += 1.0;
        }

        double norm = 0.0;
        for (double value : counts) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        float[] vector = new float[dimension];
        if (norm == 0.0) {
            return vector;
        }
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) (counts[i] / norm);
        }
        return vector;
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (token.length() > 1) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
