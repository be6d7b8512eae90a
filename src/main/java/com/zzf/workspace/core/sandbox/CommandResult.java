package com.zzf.workspace.core.sandbox;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CommandResult {
    String stdout;
    String stderr;
    /**
     * Null when the process was killed before it exited.
     */
    Integer exitCode;
    long durationMs;
    boolean timedOut;
    boolean aborted;
    boolean stdoutTruncated;
    boolean stderrTruncated;
}
