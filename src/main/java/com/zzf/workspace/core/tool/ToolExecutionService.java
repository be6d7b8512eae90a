package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;
import com.zzf.workspace.core.tool.ToolProtocol.ToolSpec;
import com.zzf.workspace.core.workspace.ToolPolicy;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import com.zzf.workspace.core.workspace.error.OperationCancelledException;
import com.zzf.workspace.core.workspace.error.ReadOnlyWorkspaceException;
import com.zzf.workspace.core.workspace.error.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Single entry point for tool calls: policy gate, cancellation, timeout, lifecycle events
 * and conversion of every failure into a {@link ToolResult}. Never throws.
 */
@Service
public class ToolExecutionService {
    private static final Logger logger = LoggerFactory.getLogger(ToolExecutionService.class);

    private final ToolRegistry registry;
    private final WorkspaceRuntime runtime;
    private final ObjectMapper mapper;
    private final List<ToolLifecycleListener> listeners;

    public ToolExecutionService(ToolRegistry registry,
                                WorkspaceRuntime runtime,
                                ObjectMapper mapper,
                                List<ToolLifecycleListener> listeners) {
        this.registry = registry;
        this.runtime = runtime;
        this.mapper = mapper;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public ToolResult execute(String toolName, JsonNode args, ToolCallContext ctx) {
        long t0 = System.nanoTime();
        ToolCallContext call = ctx != null ? ctx : ToolCallContext.builder().build();
        String operation = call.operationKey().toString();

        Optional<Tool> found = registry.get(toolName);
        if (found.isEmpty()) {
            return ToolResult.error(toolName, "unsupported_tool", "Unknown tool: " + toolName, false)
                    .withHint("List available tools with GET /api/tools.")
                    .withCall(operation, call.getTraceId(), elapsedMs(t0));
        }
        Tool tool = found.get();
        ToolPolicy policy = runtime.getPolicy(tool.getToolkit(), tool.getId());
        if (!policy.isEnabled()) {
            return ToolResult.error(tool.getId(), "tool_disabled", "Tool is disabled: " + tool.getId(), false)
                    .withCall(operation, call.getTraceId(), elapsedMs(t0));
        }
        if (tool.isMutating() && runtime.isReadOnly()) {
            return fromFailure(tool.getId(), new ReadOnlyWorkspaceException(runtime.getId()))
                    .withCall(operation, call.getTraceId(), elapsedMs(t0));
        }
        if (policy.isNeedsApproval() && !call.isApproved()) {
            return ToolResult.error(tool.getId(), "approval_required", "Tool requires approval: " + tool.getId(), true)
                    .withHint("Obtain approval and resend the call with approved=true.")
                    .withCall(operation, call.getTraceId(), elapsedMs(t0));
        }
        if (call.getSignal().isCancelled()) {
            return fromFailure(tool.getId(), new OperationCancelledException())
                    .withCall(operation, call.getTraceId(), elapsedMs(t0));
        }

        ToolCallEvent event = new ToolCallEvent(tool.getId(), tool.getToolkit(), operation, call.getTraceId());
        fireStart(event);
        ToolResult result = invoke(tool, args == null ? mapper.createObjectNode() : args, call)
                .withCall(operation, call.getTraceId(), elapsedMs(t0));
        fireEnd(event, result);
        return result;
    }

    /**
     * Specs of the tools the current policy enables. Mutating tools are hidden while the
     * workspace is read-only.
     */
    public List<ToolSpec> listToolSpecs() {
        return registry.list().stream()
                .filter(tool -> !(tool.isMutating() && runtime.isReadOnly()))
                .map(tool -> ToolSpec.of(tool, runtime.getPolicy(tool.getToolkit(), tool.getId())))
                .filter(spec -> spec.getPolicy().isEnabled())
                .collect(Collectors.toList());
    }

    private ToolResult invoke(Tool tool, JsonNode args, ToolCallContext ctx) {
        long timeoutMs = runtime.getOperationTimeoutMs();
        CompletableFuture<Tool.Result> future = null;
        try {
            future = tool.execute(args, ctx);
            return ToolResult.ok(tool.getId(), future.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            ctx.getSignal().cancel("Timed out after " + timeoutMs + "ms");
            future.cancel(true);
            return ToolResult.error(tool.getId(), "timeout", "Tool did not finish within " + timeoutMs + "ms", true)
                    .withHint("Narrow the request (fewer files, smaller range) and retry.");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.getSignal().cancel("Interrupted");
            return ToolResult.error(tool.getId(), "cancelled", "Tool call was interrupted", false);
        } catch (ExecutionException e) {
            return fromFailure(tool.getId(), e.getCause());
        } catch (RuntimeException e) {
            return fromFailure(tool.getId(), e);
        }
    }

    private ToolResult fromFailure(String tool, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WorkspaceException) {
            WorkspaceException we = (WorkspaceException) cause;
            return ToolResult.error(tool, we.getCode(), we.getMessage(), we.isRecoverable()).withHint(we.getHint());
        }
        logger.warn("tool.fail tool={} err={}", tool, String.valueOf(cause), cause);
        return ToolResult.error(tool, "internal_error", cause.getClass().getSimpleName() + ": " + cause.getMessage(), false);
    }

    private void fireStart(ToolCallEvent event) {
        for (ToolLifecycleListener listener : listeners) {
            try {
                listener.onStart(event);
            } catch (RuntimeException e) {
                logger.warn("tool.listener.fail phase=start tool={} listener={} err={}",
                        event.getTool(), listener.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private void fireEnd(ToolCallEvent event, ToolResult result) {
        for (ToolLifecycleListener listener : listeners) {
            try {
                listener.onEnd(event, result);
            } catch (RuntimeException e) {
                logger.warn("tool.listener.fail phase=end tool={} listener={} err={}",
                        event.getTool(), listener.getClass().getSimpleName(), e.toString());
            }
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
