package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.workspace.ToolPolicy;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Common plumbing of the workspace tools: the entry cancellation check, async execution,
 * classpath descriptions and schema helpers.
 * <p>
 * A timed-out call keeps running on its worker thread, so mutating tools re-check the
 * signal immediately before each change they make.
 */
@Slf4j
abstract class AbstractWorkspaceTool implements Tool {

    protected final WorkspaceRuntime workspace;
    protected final ObjectMapper objectMapper;
    private volatile String description;

    protected AbstractWorkspaceTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        this.workspace = workspace;
        this.objectMapper = objectMapper;
    }

    /**
     * One-line description used when {@code prompts/tool/<id>.txt} is missing.
     */
    protected abstract String fallbackDescription();

    protected abstract Result run(JsonNode args, ToolCallContext ctx);

    @Override
    public String getDescription() {
        String cached = description;
        if (cached == null) {
            cached = loadDescription();
            description = cached;
        }
        return cached;
    }

    @Override
    public CompletableFuture<Result> execute(JsonNode args, ToolCallContext ctx) {
        ctx.ensureActive();
        return CompletableFuture.supplyAsync(() -> {
            ctx.ensureActive();
            if (isMutating()) {
                workspace.ensureWritable();
            }
            return run(args, ctx);
        });
    }

    protected ToolPolicy policy() {
        return workspace.getPolicy(getToolkit(), getId());
    }

    /**
     * Enforces read-before-write when this tool's policy asks for it.
     */
    protected void guardWrite(ToolCallContext ctx, String normalizedPath) {
        if (policy().isRequireReadBeforeWrite()) {
            workspace.assertReadBeforeWrite(ctx.operationKey(), normalizedPath);
        }
    }

    protected void afterWrite(ToolCallContext ctx, String normalizedPath) {
        workspace.refreshAfterWrite(ctx.operationKey(), normalizedPath);
    }

    protected ObjectNode objectSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    protected static ObjectNode property(ObjectNode schema, String name, String type, String description) {
        ObjectNode prop = ((ObjectNode) schema.get("properties")).putObject(name);
        prop.put("type", type);
        prop.put("description", description);
        return prop;
    }

    protected static void required(ObjectNode schema, String... names) {
        ArrayNode array = schema.putArray("required");
        for (String name : names) {
            array.add(name);
        }
    }

    private String loadDescription() {
        Resource resource = new ClassPathResource("prompts/tool/" + getId() + ".txt");
        if (resource.exists()) {
            try {
                return StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.error("Failed to load {} tool description", getId(), e);
            }
        }
        return fallbackDescription();
    }
}
