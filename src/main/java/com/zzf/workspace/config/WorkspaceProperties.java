package com.zzf.workspace.config;

import com.zzf.workspace.core.workspace.ToolkitPolicies;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "workspace")
public class WorkspaceProperties {
    private String id = "workspace";
    private long operationTimeoutMs = 30_000L;
    private String filesystemRoot = ".workspace/fs";
    private String sandboxRoot = ".workspace/sandbox";
    private int maxFileSizeMb = 25;
    /**
     * Hides and refuses every tool that changes the filesystem.
     */
    private boolean readOnly;
    private ReadTracking readTracking = new ReadTracking();
    /**
     * Policies keyed by toolkit name ({@code filesystem}, {@code search}, {@code sandbox}).
     */
    private Map<String, ToolkitPolicies> tools = new LinkedHashMap<>();

    @Data
    public static class ReadTracking {
        private int maxOperations = 1024;
        private Duration idleTtl = Duration.ofMinutes(30);
    }
}
