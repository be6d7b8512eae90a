package com.zzf.workspace.core.fs;

import lombok.Value;

@Value
public class GrepMatch {
    String path;
    /** 1-based. */
    int line;
    String text;
}
