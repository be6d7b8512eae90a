package com.zzf.workspace.core.rag.search;

import lombok.Value;

@Value
public class IndexedDocument {
    public static final String SOURCE_FILESYSTEM = "filesystem";
    public static final String SOURCE_MANUAL = "manual";

    String path;
    String content;
    String source;
}
