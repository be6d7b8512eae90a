package com.zzf.workspace.core.tool;

import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Publishes {@code workspace.tool.calls} timed by tool and outcome.
 */
@Component
@RequiredArgsConstructor
public class MetricsToolLifecycleListener implements ToolLifecycleListener {
    static final String METER = "workspace.tool.calls";

    private final MeterRegistry registry;

    @Override
    public void onEnd(ToolCallEvent event, ToolResult result) {
        Timer.builder(METER)
                .tag("tool", event.getTool())
                .tag("toolkit", event.getToolkit())
                .tag("status", result.getStatus())
                .tag("error", result.getError() == null ? "none" : result.getError())
                .register(registry)
                .record(result.getTookMs() == null ? 0L : result.getTookMs(), TimeUnit.MILLISECONDS);
    }
}
