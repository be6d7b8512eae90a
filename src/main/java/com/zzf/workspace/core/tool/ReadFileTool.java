package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

/**
 * Reads a text file and records the read for the calling operation, which later write
 * tools check against.
 */
@Component
public class ReadFileTool extends AbstractWorkspaceTool {

    public ReadFileTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "read_file";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "Read a text file from the workspace filesystem.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace file path starting with /");
        property(schema, "offset", "integer", "0-based line offset").put("minimum", 0);
        property(schema, "limit", "integer", "Max lines to read").put("minimum", 1);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        int offset = ToolArgs.optInt(args, "offset", 0, 0, Integer.MAX_VALUE);
        int limit = ToolArgs.optInt(args, "limit", 0, 1, Integer.MAX_VALUE);

        FilesystemBackend backend = workspace.getFilesystemBackend();
        String content = offset == 0 && limit == 0
                ? backend.read(normalized)
                : backend.read(normalized, offset, limit);
        workspace.recordRead(ctx.operationKey(), normalized);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("content", content);
        return Result.builder().title(normalized).data(data).build();
    }
}
