package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.rag.search.IndexedDocument;
import com.zzf.workspace.core.rag.search.SearchIndex;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

@Component
public class WorkspaceIndexContentTool extends AbstractWorkspaceTool {

    private final SearchIndex searchIndex;

    public WorkspaceIndexContentTool(WorkspaceRuntime workspace, ObjectMapper objectMapper, SearchIndex searchIndex) {
        super(workspace, objectMapper);
        this.searchIndex = searchIndex;
    }

    @Override
    public String getId() {
        return "workspace_index_content";
    }

    @Override
    public String getToolkit() {
        return Toolkits.SEARCH;
    }

    @Override
    protected String fallbackDescription() {
        return "Index raw content under a virtual path for later search.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "path", "string", "Virtual path to store content under");
        property(schema, "content", "string", "Raw content");
        property(schema, "source", "string", "Origin label").put("default", IndexedDocument.SOURCE_MANUAL);
        required(schema, "path", "content");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String path = workspace.normalizeWorkspacePath(ToolArgs.requireNonBlank(args, "path"));
        String content = ToolArgs.requireText(args, "content");
        String source = ToolArgs.optText(args, "source", IndexedDocument.SOURCE_MANUAL);

        ctx.ensureActive();
        searchIndex.upsert(new IndexedDocument(path, content, source));

        ObjectNode data = objectMapper.createObjectNode();
        data.put("indexed", true);
        data.put("path", path);
        return Result.builder().title(path).data(data).build();
    }
}
