package com.zzf.workspace.core.workspace;

import lombok.Value;

/**
 * Logical unit of work spanning several tool calls. Uses the operation id when present,
 * otherwise {@code conversationId:toolCallId} with {@code unknown} for missing parts.
 */
@Value
public class OperationKey {
    private static final String UNKNOWN = "unknown";

    String value;

    public static OperationKey of(String operationId, String conversationId, String toolCallId) {
        if (operationId != null && !operationId.isBlank()) {
            return new OperationKey(operationId.trim());
        }
        return new OperationKey(orUnknown(conversationId) + ":" + orUnknown(toolCallId));
    }

    private static String orUnknown(String s) {
        return s == null || s.isBlank() ? UNKNOWN : s.trim();
    }

    @Override
    public String toString() {
        return value;
    }
}
