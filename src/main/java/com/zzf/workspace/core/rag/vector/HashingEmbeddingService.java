package com.zzf.workspace.core.rag.vector;

import com.zzf.workspace.core.rag.search.SearchTokenizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Deterministic, offline embedding: each token is hashed (SHA-256) into one of
 * {@code dims} buckets with a hash-derived sign, then the vector is L2-normalized.
 * Texts sharing tokens end up close; text without tokens maps to the zero vector.
 */
public final class HashingEmbeddingService implements EmbeddingService {
    private final int dims;
    private final SearchTokenizer tokenizer = new SearchTokenizer();

    public HashingEmbeddingService(int dims) {
        if (dims <= 0) {
            throw new IllegalArgumentException("dims must be positive");
        }
        this.dims = dims;
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dims];
        List<String> tokens = tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            return v;
        }
        MessageDigest digest = sha256();
        for (String token : tokens) {
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            int bucket = ((hash[0] & 0xFF) << 24 | (hash[1] & 0xFF) << 16 | (hash[2] & 0xFF) << 8 | (hash[3] & 0xFF)) & 0x7FFFFFFF;
            float sign = (hash[4] & 0x01) == 0 ? 1.0f : -1.0f;
            v[bucket % dims] += sign;
        }
        return l2Normalize(v);
    }

    public int getDims() {
        return dims;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static float[] l2Normalize(float[] v) {
        double sum = 0.0;
        for (int i = 0; i < v.length; i++) {
            sum += (double) v[i] * (double) v[i];
        }
        double norm = Math.sqrt(sum);
        if (norm == 0.0) {
            return v;
        }
        for (int i = 0; i < v.length; i++) {
            v[i] = (float) (v[i] / norm);
        }
        return v;
    }
}
