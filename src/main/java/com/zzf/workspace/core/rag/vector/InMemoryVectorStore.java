package com.zzf.workspace.core.rag.vector;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Brute-force cosine similarity over a concurrent map. Fine for a single workspace.
 * Entries with non-positive similarity are not neighbours and are never returned.
 */
@Slf4j
public final class InMemoryVectorStore implements VectorStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public void store(String id, float[] vector, Map<String, Object> metadata) {
        if (id == null || vector == null) {
            throw new IllegalArgumentException("id and vector are required");
        }
        Map<String, Object> meta = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        entries.put(id, new Entry(vector.clone(), norm(vector), meta));
    }

    @Override
    public List<VectorMatch> search(float[] vector, int limit) {
        if (vector == null || limit <= 0 || entries.isEmpty()) {
            return Collections.emptyList();
        }
        double queryNorm = norm(vector);
        List<VectorMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            Entry entry = e.getValue();
            double score = cosine(vector, queryNorm, entry);
            if (score > 0.0) {
                matches.add(new VectorMatch(e.getKey(), score, entry.metadata));
            }
        }
        matches.sort(Comparator.comparingDouble(VectorMatch::getScore).reversed().thenComparing(VectorMatch::getId));
        return matches.size() <= limit ? matches : new ArrayList<>(matches.subList(0, limit));
    }

    @Override
    public void delete(String id) {
        if (id != null) {
            entries.remove(id);
        }
    }

    public int size() {
        return entries.size();
    }

    private static double cosine(float[] query, double queryNorm, Entry entry) {
        if (queryNorm == 0.0 || entry.norm == 0.0) {
            return 0.0;
        }
        int dims = Math.min(query.length, entry.vector.length);
        if (query.length != entry.vector.length) {
            log.warn("vector.dims.mismatch query={} stored={}", query.length, entry.vector.length);
        }
        double dot = 0.0;
        for (int i = 0; i < dims; i++) {
            dot += (double) query[i] * (double) entry.vector[i];
        }
        return dot / (queryNorm * entry.norm);
    }

    private static double norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * (double) x;
        }
        return Math.sqrt(sum);
    }

    private static final class Entry {
        private final float[] vector;
        private final double norm;
        private final Map<String, Object> metadata;

        private Entry(float[] vector, double norm, Map<String, Object> metadata) {
            this.vector = vector;
            this.norm = norm;
            this.metadata = metadata;
        }
    }
}
