package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.fs.GrepMatch;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class GrepTool extends AbstractWorkspaceTool {
    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 500;

    public GrepTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "grep";
    }

    @Override
    public String getToolkit() {
        return Toolkits.FILESYSTEM;
    }

    @Override
    protected String fallbackDescription() {
        return "Search file contents for lines matching a regular expression.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "pattern", "string", "Java regular expression matched against each line");
        property(schema, "path", "string", "File or directory to search (default /)");
        property(schema, "glob", "string", "Only search files matching this glob, e.g. **/*.md");
        property(schema, "limit", "integer", "Maximum number of matches")
                .put("minimum", 1)
                .put("maximum", MAX_LIMIT)
                .put("default", DEFAULT_LIMIT);
        required(schema, "pattern");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String pattern = ToolArgs.requireNonBlank(args, "pattern");
        String path = workspace.normalizeWorkspacePath(ToolArgs.optText(args, "path", "/"));
        String glob = ToolArgs.optText(args, "glob", null);
        int limit = ToolArgs.optInt(args, "limit", DEFAULT_LIMIT, 1, MAX_LIMIT);

        List<GrepMatch> matches = workspace.getFilesystemBackend().grepRaw(pattern, path, glob);
        boolean truncated = matches.size() > limit;
        List<GrepMatch> kept = truncated ? matches.subList(0, limit) : matches;

        ObjectNode data = objectMapper.createObjectNode();
        data.put("pattern", pattern);
        ArrayNode array = data.putArray("matches");
        for (GrepMatch match : kept) {
            array.addObject()
                    .put("path", match.getPath())
                    .put("line", match.getLine())
                    .put("text", match.getText());
        }
        return Result.builder()
                .title(pattern)
                .data(data)
                .metadata(Map.of("matches", kept.size(), "truncated", truncated))
                .build();
    }
}
