package com.zzf.workspace.core.rag.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchOptions {
    public static final int DEFAULT_TOP_K = 5;
    public static final double DEFAULT_VECTOR_WEIGHT = 0.6;
    public static final int DEFAULT_SNIPPET_LENGTH = 200;

    @Builder.Default
    SearchMode mode = SearchMode.HYBRID;
    @Builder.Default
    int topK = DEFAULT_TOP_K;
    @Builder.Default
    double vectorWeight = DEFAULT_VECTOR_WEIGHT;
    @Builder.Default
    double minScore = 0.0;
    @Builder.Default
    int snippetLength = DEFAULT_SNIPPET_LENGTH;

    public static SearchOptions defaults() {
        return SearchOptions.builder().build();
    }
}
