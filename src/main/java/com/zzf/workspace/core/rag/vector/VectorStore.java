package com.zzf.workspace.core.rag.vector;

import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour storage. Durability is whatever the implementation provides.
 */
public interface VectorStore {

    /**
     * Stores or replaces the vector under {@code id}.
     */
    void store(String id, float[] vector, Map<String, Object> metadata);

    /**
     * Best matches first, at most {@code limit}.
     */
    List<VectorMatch> search(float[] vector, int limit);

    void delete(String id);
}
