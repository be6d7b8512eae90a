package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.rag.search.SearchHit;
import com.zzf.workspace.core.rag.search.SearchIndex;
import com.zzf.workspace.core.rag.search.SearchMode;
import com.zzf.workspace.core.rag.search.SearchOptions;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class WorkspaceSearchTool extends AbstractWorkspaceTool {

    private final SearchIndex searchIndex;

    public WorkspaceSearchTool(WorkspaceRuntime workspace, ObjectMapper objectMapper, SearchIndex searchIndex) {
        super(workspace, objectMapper);
        this.searchIndex = searchIndex;
    }

    @Override
    public String getId() {
        return "workspace_search";
    }

    @Override
    public String getToolkit() {
        return Toolkits.SEARCH;
    }

    @Override
    protected String fallbackDescription() {
        return "Search indexed workspace content using BM25, vector, or hybrid search.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "query", "string", "Search query").put("minLength", 1);
        ObjectNode mode = property(schema, "mode", "string", "Ranking mode");
        mode.putArray("enum").add("bm25").add("vector").add("hybrid");
        mode.put("default", "hybrid");
        property(schema, "top_k", "integer", "Maximum number of results")
                .put("minimum", 1)
                .put("default", SearchOptions.DEFAULT_TOP_K);
        property(schema, "min_score", "number", "Drop results scoring below this")
                .put("minimum", 0)
                .put("maximum", 1)
                .put("default", 0);
        property(schema, "include_content", "boolean", "Return full document content").put("default", true);
        property(schema, "snippet_length", "integer", "Maximum snippet characters")
                .put("minimum", 1)
                .put("default", SearchOptions.DEFAULT_SNIPPET_LENGTH);
        property(schema, "vector_weight", "number", "Weight of the vector score in hybrid mode")
                .put("minimum", 0)
                .put("maximum", 1)
                .put("default", SearchOptions.DEFAULT_VECTOR_WEIGHT);
        required(schema, "query");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String query = ToolArgs.requireText(args, "query");
        if (query.isEmpty()) {
            throw new InvalidToolArgumentsException("query must not be empty");
        }
        SearchOptions options = SearchOptions.builder()
                .mode(SearchMode.parse(ToolArgs.optText(args, "mode", null)))
                .topK(ToolArgs.optInt(args, "top_k", SearchOptions.DEFAULT_TOP_K, 1, Integer.MAX_VALUE))
                .minScore(ToolArgs.optDouble(args, "min_score", 0.0, 0.0, 1.0))
                .snippetLength(ToolArgs.optInt(args, "snippet_length", SearchOptions.DEFAULT_SNIPPET_LENGTH, 1, Integer.MAX_VALUE))
                .vectorWeight(ToolArgs.optDouble(args, "vector_weight", SearchOptions.DEFAULT_VECTOR_WEIGHT, 0.0, 1.0))
                .build();
        boolean includeContent = ToolArgs.optBool(args, "include_content", true);

        List<SearchHit> hits = searchIndex.search(query, options);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("query", query);
        ArrayNode results = data.putArray("results");
        for (SearchHit hit : hits) {
            ObjectNode node = results.addObject();
            node.put("path", hit.getPath());
            node.put("score", hit.getScore());
            ObjectNode details = node.putObject("scoreDetails");
            if (hit.getBm25Score() != null) {
                details.put("bm25", hit.getBm25Score());
            }
            if (hit.getVectorScore() != null) {
                details.put("vector", hit.getVectorScore());
            }
            if (includeContent) {
                node.put("content", hit.getContent());
            }
            node.put("snippet", hit.getSnippet());
            node.putArray("lineRange").add(hit.getStartLine()).add(hit.getEndLine());
        }
        return Result.builder()
                .title(query)
                .data(data)
                .metadata(Map.of("mode", options.getMode().wireName(), "hits", hits.size()))
                .build();
    }
}
