package com.zzf.workspace.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.workspace.core.tool.ToolCallContext;
import com.zzf.workspace.core.tool.ToolExecutionService;
import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;
import com.zzf.workspace.core.tool.ToolProtocol.ToolSpec;
import com.zzf.workspace.infrastructure.TraceIdFilter;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP surface for the orchestration layer. Tool failures are returned as
 * {@code status=error} results with HTTP 200.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolExecutionService toolExecutionService;

    @Data
    public static class ToolCallRequest {
        private JsonNode args;
        private String operationId;
        private String conversationId;
        private String toolCallId;
        private boolean approved;
    }

    @GetMapping
    public List<ToolSpec> listTools() {
        return toolExecutionService.listToolSpecs();
    }

    @PostMapping("/{name}")
    public ToolResult call(@PathVariable("name") String name, @RequestBody(required = false) ToolCallRequest request) {
        ToolCallRequest body = request == null ? new ToolCallRequest() : request;
        ToolCallContext ctx = ToolCallContext.builder()
                .operationId(body.getOperationId())
                .conversationId(body.getConversationId())
                .toolCallId(body.getToolCallId())
                .traceId(MDC.get(TraceIdFilter.MDC_KEY))
                .approved(body.isApproved())
                .build();
        return toolExecutionService.execute(name, body.getArgs(), ctx);
    }
}
