package com.zzf.workspace.core.fs;

import lombok.Value;

import java.time.Instant;

@Value
public class FileStat {
    String path;
    boolean dir;
    long size;
    long modifiedAtNanos;
    Instant modifiedAt;
    Instant createdAt;
}
