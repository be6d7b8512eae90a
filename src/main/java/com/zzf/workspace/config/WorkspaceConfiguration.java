package com.zzf.workspace.config;

import com.zzf.workspace.core.rag.search.HybridSearchIndex;
import com.zzf.workspace.core.rag.search.SearchIndex;
import com.zzf.workspace.core.rag.vector.EmbeddingService;
import com.zzf.workspace.core.rag.vector.VectorStore;
import com.zzf.workspace.core.sandbox.CommandExecutor;
import com.zzf.workspace.core.sandbox.LocalCommandExecutor;
import com.zzf.workspace.core.tool.Tool;
import com.zzf.workspace.core.tool.ToolRegistry;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Configuration
public class WorkspaceConfiguration {

    @Bean(initMethod = "init", destroyMethod = "destroy")
    public WorkspaceRuntime workspaceRuntime(WorkspaceProperties properties) {
        return WorkspaceRuntime.builder()
                .id(properties.getId())
                .operationTimeoutMs(properties.getOperationTimeoutMs())
                .filesystemRootDir(resolve(properties.getFilesystemRoot()))
                .sandboxRootDir(resolve(properties.getSandboxRoot()))
                .toolConfig(properties.getTools())
                .maxFileSizeMb(properties.getMaxFileSizeMb())
                .maxTrackedOperations(properties.getReadTracking().getMaxOperations())
                .readTrackingIdleTtl(properties.getReadTracking().getIdleTtl())
                .readOnly(properties.isReadOnly())
                .build();
    }

    @Bean
    public SearchIndex searchIndex(EmbeddingService embeddingService, VectorStore vectorStore) {
        return new HybridSearchIndex(embeddingService, vectorStore);
    }

    @Bean
    public CommandExecutor commandExecutor() {
        return new LocalCommandExecutor();
    }

    @Bean
    public ToolRegistry toolRegistry(List<Tool> tools) {
        return new ToolRegistry(tools);
    }

    private static Path resolve(String dir) {
        return Paths.get(dir).toAbsolutePath().normalize();
    }
}
