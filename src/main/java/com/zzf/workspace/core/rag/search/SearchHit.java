package com.zzf.workspace.core.rag.search;

import lombok.Builder;
import lombok.Value;

/**
 * One ranked result. {@code score} is in [0, 1]; the per-source scores are null when
 * that source did not return the document.
 */
@Value
@Builder
public class SearchHit {
    String path;
    double score;
    Double bm25Score;
    Double vectorScore;
    String content;
    String snippet;
    int startLine;
    int endLine;
}
