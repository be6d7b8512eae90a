package com.zzf.workspace.core.tool;

import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingToolLifecycleListener implements ToolLifecycleListener {

    @Override
    public void onStart(ToolCallEvent event) {
        log.info("tool.call traceId={} tool={} toolkit={} op={}",
                event.getTraceId(), event.getTool(), event.getToolkit(), event.getOperation());
    }

    @Override
    public void onEnd(ToolCallEvent event, ToolResult result) {
        if (result.isSuccess()) {
            log.info("tool.result traceId={} tool={} op={} status={} tookMs={}",
                    event.getTraceId(), event.getTool(), event.getOperation(), result.getStatus(), result.getTookMs());
        } else {
            log.warn("tool.result traceId={} tool={} op={} status={} error={} msg={}",
                    event.getTraceId(), event.getTool(), event.getOperation(), result.getStatus(),
                    result.getError(), result.getMessage());
        }
    }
}
