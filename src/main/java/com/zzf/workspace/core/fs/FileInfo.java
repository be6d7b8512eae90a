package com.zzf.workspace.core.fs;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class FileInfo {
    String path;
    @JsonProperty("is_dir")
    boolean dir;
    long size;
}
