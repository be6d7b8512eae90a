package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class WriteFileTool extends AbstractWorkspaceTool {

    public WriteFileTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "write_file";
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
        return "Write a file into the workspace filesystem.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace file path starting with /");
        property(schema, "content", "string", "File contents");
        property(schema, "overwrite", "boolean", "Overwrite if the file exists").put("default", false);
        property(schema, "create_parent_dirs", "boolean", "Create parent directories if missing").put("default", true);
        required(schema, "path", "content");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        String content = ToolArgs.requireText(args, "content");
        boolean overwrite = ToolArgs.optBool(args, "overwrite", false);
        boolean createParents = ToolArgs.optBool(args, "create_parent_dirs", true);
        if ("/".equals(normalized)) {
            throw new InvalidToolArgumentsException("path must name a file");
        }

        guardWrite(ctx, normalized);

        FilesystemBackend backend = workspace.getFilesystemBackend();
        if (createParents) {
            String parent = parentOf(normalized);
            if (!"/".equals(parent)) {
                ctx.ensureActive();
                backend.mkdir(parent, true);
            }
        }
        boolean exists = backend.exists(normalized);
        if (exists && !overwrite) {
            throw new InvalidToolArgumentsException("File already exists: " + normalized + "; set overwrite=true to replace it");
        }
        ctx.ensureActive();
        backend.write(normalized, content);
        afterWrite(ctx, normalized);
        log.debug("fs.write op={} path={} chars={} overwritten={}", ctx.operationKey(), normalized, content.length(), exists);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        data.put("overwritten", exists);
        return Result.builder().title(normalized).data(data).build();
    }

    static String parentOf(String normalized) {
        int idx = normalized.lastIndexOf('/');
        return idx <= 0 ? "/" : normalized.substring(0, idx);
    }
}
