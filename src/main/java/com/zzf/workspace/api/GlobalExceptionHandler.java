package com.zzf.workspace.api;

import com.zzf.workspace.core.tool.ToolProtocol.ToolResult;
import com.zzf.workspace.infrastructure.TraceIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Failures that happen before a tool is reached (unparseable body, framework errors) in the
 * same shape as tool results.
 */
@Slf4j
@RestControllerAdvice
public final class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ToolResult> handleUnreadableBody(HttpMessageNotReadableException e) {
        ToolResult body = ToolResult.error(null, "invalid_arguments", "Request body is not valid JSON", true)
                .toBuilder().traceId(MDC.get(TraceIdFilter.MDC_KEY)).build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ToolResult> handleUnknownException(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            msg = e.getClass().getSimpleName();
        } else {
            msg = e.getClass().getSimpleName() + ": " + msg;
        }
        log.error("api.fail err={}", msg, e);
        ToolResult body = ToolResult.error(null, "internal_error", msg, false)
                .toBuilder().traceId(MDC.get(TraceIdFilter.MDC_KEY)).build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(body);
    }
}
