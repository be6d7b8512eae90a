package com.zzf.workspace.core.rag.vector;

import java.util.ArrayList;
import java.util.List;

public interface EmbeddingService {
    float[] embed(String text);

    /**
     * Embeddings for several inputs, in input order.
     */
    default List<float[]> embedAll(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embed(text));
        }
        return out;
    }
}
