package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

@Component
public class MkdirTool extends AbstractWorkspaceTool {

    public MkdirTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "mkdir";
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
        return "Create a directory in the workspace filesystem.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace directory path starting with /");
        property(schema, "recursive", "boolean", "Create missing parents").put("default", true);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        boolean recursive = ToolArgs.optBool(args, "recursive", true);
        ctx.ensureActive();
        workspace.getFilesystemBackend().mkdir(normalized, recursive);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("created", true);
        return Result.builder().title(normalized).data(data).build();
    }
}
