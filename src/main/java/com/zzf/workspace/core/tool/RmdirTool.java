package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FileStat;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Removes a directory. Without {@code recursive} only an empty directory goes; a missing
 * directory is reported as {@code deleted=false}.
 */
@Slf4j
@Component
public class RmdirTool extends AbstractWorkspaceTool {

    public RmdirTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "rmdir";
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
        return "Remove a directory from the workspace filesystem.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace directory path starting with /");
        property(schema, "recursive", "boolean", "Remove the directory and everything below it").put("default", false);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String normalized = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        boolean recursive = ToolArgs.optBool(args, "recursive", false);
        FilesystemBackend backend = workspace.getFilesystemBackend();

        ObjectNode data = objectMapper.createObjectNode();
        data.put("path", normalized);
        Optional<FileStat> stat = backend.findStat(normalized);
        if (stat.isEmpty()) {
            data.put("deleted", false);
            return Result.builder().title(normalized).data(data).build();
        }
        if (!stat.get().isDir()) {
            throw new InvalidToolArgumentsException("Not a directory: " + normalized + "; use delete_file for files");
        }

        guardWrite(ctx, normalized);
        ctx.ensureActive();
        backend.delete(normalized, recursive);
        afterWrite(ctx, normalized);
        log.info("fs.rmdir op={} path={} recursive={}", ctx.operationKey(), normalized, recursive);

        data.put("deleted", true);
        return Result.builder().title(normalized).data(data).build();
    }
}
