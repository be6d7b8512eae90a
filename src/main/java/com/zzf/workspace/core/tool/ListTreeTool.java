package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FileInfo;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

/**
 * Recursive listing; each directory is reported before its contents. Directory paths
 * end with {@code /}.
 */
@Component
public class ListTreeTool extends AbstractWorkspaceTool {
    static final int DEFAULT_MAX_DEPTH = 4;
    static final int MAX_DEPTH_LIMIT = 20;

    public ListTreeTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "list_tree";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "List files and directories recursively.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace directory path starting with /");
        property(schema, "max_depth", "integer", "Maximum depth below path")
                .put("minimum", 0)
                .put("maximum", MAX_DEPTH_LIMIT)
                .put("default", DEFAULT_MAX_DEPTH);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        int maxDepth = ToolArgs.optInt(args, "max_depth", DEFAULT_MAX_DEPTH, 0, MAX_DEPTH_LIMIT);

        ArrayNode entries = objectMapper.createArrayNode();
        walk(workspace.getFilesystemBackend(), normalized, 0, maxDepth, entries, ctx);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.set("entries", entries);
        return Result.builder().title(normalized).data(data).build();
    }

    private void walk(FilesystemBackend backend, String dir, int depth, int maxDepth, ArrayNode out, ToolCallContext ctx) {
        if (depth > maxDepth) {
            return;
        }
        ctx.ensureActive();
        for (FileInfo entry : backend.lsInfo(dir)) {
            ObjectNode node = out.addObject();
            if (entry.isDir()) {
                node.put("path", entry.getPath() + "/");
                node.put("is_dir", true);
                walk(backend, entry.getPath(), depth + 1, maxDepth, out, ctx);
            } else {
                node.put("path", entry.getPath());
                node.put("is_dir", false);
            }
        }
    }
}
