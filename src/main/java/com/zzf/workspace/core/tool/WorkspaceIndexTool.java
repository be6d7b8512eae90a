package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.FileInfo;
import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.rag.search.IndexedDocument;
import com.zzf.workspace.core.rag.search.SearchIndex;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.FileTooLargeException;
import com.zzf.workspace.core.workspace.error.WorkspaceIoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads workspace files matching a glob and upserts them into the search index.
 * {@code totalFound} counts every glob match, directories included, before truncation.
 * Files that are not text (NUL bytes or invalid UTF-8), too large, or unreadable are
 * skipped and counted in {@code skipped}; they never abort the call.
 */
@Slf4j
@Component
public class WorkspaceIndexTool extends AbstractWorkspaceTool {
    static final int DEFAULT_MAX_FILES = 200;

    private final SearchIndex searchIndex;

    public WorkspaceIndexTool(WorkspaceRuntime workspace, ObjectMapper objectMapper, SearchIndex searchIndex) {
        super(workspace, objectMapper);
        this.searchIndex = searchIndex;
    }

    @Override
    public String getId() {
        return "workspace_index";
    }

    @Override
    public String getToolkit() {
        return Toolkits.SEARCH;
    }

    @Override
    protected String fallbackDescription() {
        return "Index workspace filesystem files under a path (optionally filtered by glob).";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Workspace directory path starting with /");
        property(schema, "glob", "string", "Glob filter").put("default", "**/*");
        property(schema, "max_files", "integer", "Maximum number of files to index")
                .put("minimum", 1)
                .put("default", DEFAULT_MAX_FILES);
        required(schema, "path");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String base = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        String glob = ToolArgs.optText(args, "glob", "**/*");
        int maxFiles = ToolArgs.optInt(args, "max_files", DEFAULT_MAX_FILES, 1, Integer.MAX_VALUE);

        FilesystemBackend backend = workspace.getFilesystemBackend();
        List<FileInfo> matches = backend.globInfo(glob, base);
        List<FileInfo> files = matches.stream()
                .filter(m -> !m.isDir())
                .limit(maxFiles)
                .collect(Collectors.toList());

        int indexed = 0;
        int skipped = 0;
        for (FileInfo file : files) {
            ctx.ensureActive();
            String content;
            try {
                content = backend.read(file.getPath());
            } catch (FileTooLargeException | WorkspaceIoException e) {
                log.warn("search.index.skip path={} code={} err={}", file.getPath(), e.getCode(), e.getMessage());
                skipped++;
                continue;
            }
            if (!looksLikeText(content)) {
                log.debug("search.index.skip path={} reason=binary", file.getPath());
                skipped++;
                continue;
            }
            ctx.ensureActive();
            searchIndex.upsert(new IndexedDocument(file.getPath(), content, IndexedDocument.SOURCE_FILESYSTEM));
            indexed++;
        }
        log.info("search.index op={} path={} glob={} indexed={} skipped={} totalFound={}",
                ctx.operationKey(), base, glob, indexed, skipped, matches.size());

        ObjectNode data = objectMapper.createObjectNode();
        data.put("indexed", indexed);
        data.put("skipped", skipped);
        data.put("totalFound", matches.size());
        return Result.builder().title(base).data(data).build();
    }

    static boolean looksLikeText(String content) {
        return content.indexOf(0) < 0 && content.indexOf(0xFFFD) < 0;
    }
}
