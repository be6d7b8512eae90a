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
public class GlobTool extends AbstractWorkspaceTool {

    public GlobTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "glob";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "Find files in the workspace filesystem matching a glob pattern.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "pattern", "string", "Glob pattern, e.g. **/*.md");
        property(schema, "path", "string", "Workspace directory to search under").put("default", "/");
        required(schema, "pattern");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String pattern = ToolArgs.requireNonBlank(args, "pattern");
        String base = workspace.normalizeWorkspacePath(ToolArgs.optText(args, "path", "/"));
        List<FileInfo> matches = workspace.getFilesystemBackend().globInfo(pattern, base);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("pattern", pattern);
        data.set("matches", objectMapper.valueToTree(matches));
        return Result.builder()
                .title(pattern)
                .data(data)
                .metadata(Map.of("count", matches.size(), "path", base))
                .build();
    }
}
