package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FileStat;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

@Component
public class StatTool extends AbstractWorkspaceTool {

    public StatTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "stat";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "Get metadata for a workspace file or directory.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace path starting with /");
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        FileStat stat = workspace.getFilesystemBackend().stat(normalized);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("is_dir", stat.isDir());
        data.put("size", stat.getSize());
        data.put("modified_at", String.valueOf(stat.getModifiedAt()));
        data.put("created_at", String.valueOf(stat.getCreatedAt()));
        return Result.builder().title(normalized).data(data).build();
    }
}
