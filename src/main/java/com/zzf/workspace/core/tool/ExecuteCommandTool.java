package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.workspace.core.sandbox.CommandExecutor;
import com.zzf.workspace.core.sandbox.CommandRequest;
import com.zzf.workspace.core.sandbox.CommandResult;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.InvalidToolArgumentsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs a shell command with its working directory inside the sandbox root. The command's
 * own timeout never exceeds the workspace operation timeout.
 */
@Slf4j
@Component
public class ExecuteCommandTool extends AbstractWorkspaceTool {
    static final int DEFAULT_TIMEOUT_MS = 10_000;
    static final int DEFAULT_MAX_OUTPUT_KB = 64;

    private final CommandExecutor executor;

    public ExecuteCommandTool(WorkspaceRuntime workspace, ObjectMapper objectMapper, CommandExecutor executor) {
        super(workspace, objectMapper);
        this.executor = executor;
    }

    @Override
    public String getId() {
        return "execute_command";
    }

    @Override
    public String getToolkit() {
        return Toolkits.SANDBOX;
    }

    @Override
    protected String fallbackDescription() {
        return "Execute a shell command inside the workspace sandbox root.";
    }

    @Override
    public JsonNode getParametersSchema() {
        ObjectNode schema = objectSchema();
        property(schema, "command", "string", "Command to execute").put("minLength", 1);
        property(schema, "cwd", "string", "Working directory below the sandbox root (default: the root)");
        property(schema, "timeout_ms", "integer", "Command timeout, capped by the workspace timeout")
                .put("minimum", 1)
                .put("default", DEFAULT_TIMEOUT_MS);
        property(schema, "env", "object", "Extra environment variables")
                .putObject("additionalProperties").put("type", "string");
        property(schema, "max_output_kb", "integer", "Per-stream output cap in KiB")
                .put("minimum", 1)
                .put("default", DEFAULT_MAX_OUTPUT_KB);
        required(schema, "command");
        return schema;
    }

    @Override
    protected Result run(JsonNode args, ToolCallContext ctx) {
        String command = ToolArgs.requireNonBlank(args, "command");
        Path cwd = workspace.resolveSandboxCwd(ToolArgs.optText(args, "cwd", null));
        int timeoutMs = ToolArgs.optInt(args, "timeout_ms", DEFAULT_TIMEOUT_MS, 1, Integer.MAX_VALUE);
        int maxOutputKb = ToolArgs.optInt(args, "max_output_kb", DEFAULT_MAX_OUTPUT_KB, 1, 1024 * 1024);
        Map<String, String> env = env(args);
        long effectiveTimeout = Math.min(timeoutMs, workspace.getOperationTimeoutMs());

        ctx.ensureActive();
        log.info("sandbox.exec op={} cwd={} timeoutMs={} cmd={}", ctx.operationKey(), cwd, effectiveTimeout, command);
        CommandResult result = executor.execute(CommandRequest.builder()
                .command(command)
                .cwd(cwd)
                .env(env)
                .timeoutMs(effectiveTimeout)
                .maxOutputBytes(maxOutputKb * 1024)
                .cancelled(ctx.getSignal()::isCancelled)
                .build());
        log.info("sandbox.exit op={} exitCode={} timedOut={} aborted={} durationMs={}",
                ctx.operationKey(), result.getExitCode(), result.isTimedOut(), result.isAborted(), result.getDurationMs());

        ObjectNode data = objectMapper.createObjectNode();
        data.put("stdout", result.getStdout());
        data.put("stderr", result.getStderr());
        if (result.getExitCode() == null) {
            data.putNull("exitCode");
        } else {
            data.put("exitCode", result.getExitCode());
        }
        data.put("durationMs", result.getDurationMs());
        data.put("timedOut", result.isTimedOut());
        data.put("aborted", result.isAborted());
        data.put("stdoutTruncated", result.isStdoutTruncated());
        data.put("stderrTruncated", result.isStderrTruncated());
        return Result.builder().title(command).data(data).build();
    }

    private static Map<String, String> env(JsonNode args) {
        JsonNode node = args == null ? null : args.get("env");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new InvalidToolArgumentsException("env must be an object of strings");
        }
        Map<String, String> env = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new InvalidToolArgumentsException("env." + field.getKey() + " must be a string");
            }
            env.put(field.getKey(), field.getValue().asText());
        }
        return env;
    }
}
