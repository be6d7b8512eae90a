package com.zzf.workspace.core.sandbox;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.BooleanSupplier;

@Value
@Builder
public class CommandRequest {
    String command;
    /**
     * Host directory, already resolved inside the sandbox root.
     */
    Path cwd;
    @Builder.Default
    Map<String, String> env = Map.of();
    long timeoutMs;
    /**
     * Per stream.
     */
    int maxOutputBytes;
    @Builder.Default
    BooleanSupplier cancelled = () -> false;
}
