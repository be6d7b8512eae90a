package com.zzf.workspace.core.tool;

import lombok.Value;

@Value
public class ToolCallEvent {
    String tool;
    String toolkit;
    String operation;
    String traceId;
}
