package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FileInfo;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class LsTool extends AbstractWorkspaceTool {

    public LsTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "ls";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "List files and directories in a workspace directory.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace path starting with /").put("default", "/");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.optText(args, "path", "/"));
        List<FileInfo> entries = workspace.getFilesystemBackend().lsInfo(normalized);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.set("entries", objectMapper.valueToTree(entries));
        return Result.builder()
                .title(normalized)
                .data(data)
                .metadata(Map.of("count", entries.size()))
                .build();
    }
}
