package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workspace.core.workspace.ToolPolicy;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

public final class ToolProtocol {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    private ToolProtocol() {}

    @Value
    public static class ToolSpec {
        String name;
        String toolkit;
        String description;
        JsonNode inputSchema;
        ToolPolicy policy;

        static ToolSpec of(Tool tool, ToolPolicy policy) {
            return new ToolSpec(tool.getId(), tool.getToolkit(), tool.getDescription(), tool.getParametersSchema(), policy);
        }
    }

    /**
     * Structured outcome of one tool call. Failures carry a stable {@code error} code and
     * never a stack trace.
     */
    @Value
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ToolResult {
        String tool;
        String status;
        String error;
        String message;
        String hint;
        Boolean recoverable;
        Long tookMs;
        String operation;
        String traceId;
        String title;
        JsonNode result;
        Map<String, Object> metadata;

        public static ToolResult ok(String tool, Tool.Result result) {
            return ToolResult.builder()
                    .tool(tool)
                    .status(STATUS_OK)
                    .title(result == null ? null : result.getTitle())
                    .result(result == null ? null : result.getData())
                    .metadata(result == null || result.getMetadata() == null || result.getMetadata().isEmpty()
                            ? null : result.getMetadata())
                    .build();
        }

        public static ToolResult error(String tool, String error, String message, boolean recoverable) {
            return ToolResult.builder()
                    .tool(tool)
                    .status(STATUS_ERROR)
                    .error(error)
                    .message(message)
                    .recoverable(recoverable)
                    .build();
        }

        public ToolResult withHint(String hint) {
            return hint == null || hint.isBlank() ? this : toBuilder().hint(hint).build();
        }

        public ToolResult withCall(String operation, String traceId, long tookMs) {
            return toBuilder().operation(operation).traceId(traceId).tookMs(tookMs).build();
        }

        public boolean isSuccess() {
            return STATUS_OK.equals(status);
        }
    }
}
