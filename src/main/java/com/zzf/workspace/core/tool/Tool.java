package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A single agent-callable operation.
 */
public interface Tool {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class Result {
        private String title;
        private JsonNode data;
        private Map<String, Object> metadata;
    }

    String getId();

    /**
     * Policy namespace the tool belongs to, see {@link Toolkits}.
     */
    String getToolkit();

    String getDescription();

    JsonNode getParametersSchema();

    CompletableFuture<Result> execute(JsonNode args, ToolCallContext ctx);

    /**
     * Whether the tool changes the workspace filesystem. Such tools are hidden and refused
     * when the workspace is read-only.
     */
    default boolean isMutating() {
        return false;
    }
}
