package com.zzf.workspace.core.tool;

import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;

/**
 * Observer of tool calls. {@link #onEnd} fires once for every call that fired {@link #onStart},
 * whatever its outcome. Listener failures are logged and never change the result.
 */
public interface ToolLifecycleListener {

    default void onStart(ToolCallEvent event) {
    }

    default void onEnd(ToolCallEvent event, ToolResult result) {
    }
}
