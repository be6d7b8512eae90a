package com.zzf.workspace.core.rag.vector;

import lombok.Value;

import java.util.Map;

@Value
public class VectorMatch {
    String id;
    double score;
    Map<String, Object> metadata;
}
