package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

@Component
public class EditFileTool extends AbstractWorkspaceTool {

    public EditFileTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "edit_file";
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
        return "Edit a file by replacing a specific string.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace file path starting with /");
        property(schema, "old_string", "string", "Exact string to replace");
        property(schema, "new_string", "string", "Replacement string");
        property(schema, "replace_all", "boolean", "Replace all occurrences").put("default", false);
        required(schema, "path", "old_string", "new_string");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        String oldString = ToolArgs.requireText(args, "old_string");
        String newString = ToolArgs.requireText(args, "new_string");
        boolean replaceAll = ToolArgs.optBool(args, "replace_all", false);

        guardWrite(ctx, normalized);
        ctx.ensureActive();
        int occurrences = workspace.getFilesystemBackend().edit(normalized, oldString, newString, replaceAll);
        afterWrite(ctx, normalized);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("occurrences", occurrences);
        return Result.builder().title(normalized).data(data).build();
    }
}
