package com.zzf.workspace.core.tool;

import com.zzf.workspace.core.workspace.OperationKey;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a tool call needs to know about its caller. Passed explicitly to every
 * tool; nothing is read from thread-local or global state.
 */
@Value
@Builder
public class ToolCallContext {
    String operationId;
    String conversationId;
    String toolCallId;
    String traceId;
    /**
     * Set by the orchestration layer once a human (or policy) approved this call.
     */
    boolean approved;
    @Builder.Default
    CancellationSignal signal = CancellationSignal.active();

    public OperationKey operationKey() {
        return OperationKey.of(operationId, conversationId, toolCallId);
    }

    public void ensureActive() {
        signal.throwIfCancelled();
    }
}
