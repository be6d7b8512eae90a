package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DeleteFileTool extends AbstractWorkspaceTool {

    public DeleteFileTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "delete_file";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    public boolean isMutating() {
        return true;
    }

    @Override
    protected String fallbackDescription() {
        return "Delete a file or directory from the workspace filesystem.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace path starting with /");
        property(schema, "recursive", "boolean", "Delete directories recursively").put("default", false);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        boolean recursive = ToolArgs.optBool(args, "recursive", false);

        guardWrite(ctx, normalized);
        ctx.ensureActive();
        workspace.getFilesystemBackend().delete(normalized, recursive);
        afterWrite(ctx, normalized);
        log.info("fs.delete op={} path={} recursive={}", ctx.operationKey(), normalized, recursive);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("deleted", true);
        return Result.builder().title(normalized).data(data).build();
    }
}
