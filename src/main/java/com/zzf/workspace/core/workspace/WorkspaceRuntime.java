package com.zzf.workspace.core.workspace;

import com.zzf.workspace.core.fs.FilesystemBackend;
import com.zzf.workspace.core.fs.LocalFilesystemBackend;
import com.zzf.workspace.core.workspace.error.ReadOnlyWorkspaceException;
import com.zzf.workspace.core.workspace.error.WorkspaceIoException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * One isolated workspace: a sandboxed filesystem root, a sandbox working directory,
 * the tool policies that apply to it and read tracking for its operations.
 */
@Slf4j
public class WorkspaceRuntime {
    public static final long DEFAULT_OPERATION_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_FILE_SIZE_MB = 25;

    private final String id;
    private final long operationTimeoutMs;
    private final PathSandbox filesystemSandbox;
    private final PathSandbox sandboxCwdSandbox;
    private final ToolPolicyResolver policyResolver;
    private final FilesystemBackend filesystemBackend;
    private final ReadTracker readTracker;
    private final boolean readOnly;

    @Builder
    private WorkspaceRuntime(String id,
                             Long operationTimeoutMs,
                             Path filesystemRootDir,
                             Path sandboxRootDir,
                             Map<String, ToolkitPolicies> toolConfig,
                             Integer maxFileSizeMb,
                             Integer maxTrackedOperations,
                             Duration readTrackingIdleTtl,
                             FilesystemBackend filesystemBackend,
                             boolean readOnly,
                             Clock clock) {
        if (filesystemRootDir == null || sandboxRootDir == null) {
            throw new IllegalArgumentException("filesystemRootDir and sandboxRootDir are required");
        }
        this.id = id == null || id.isBlank() ? "workspace" : id.trim();
        this.operationTimeoutMs = operationTimeoutMs == null || operationTimeoutMs <= 0
                ? DEFAULT_OPERATION_TIMEOUT_MS
                : operationTimeoutMs;
        this.filesystemSandbox = new PathSandbox(filesystemRootDir, "workspace filesystem");
        this.sandboxCwdSandbox = new PathSandbox(sandboxRootDir, "sandbox");
        this.policyResolver = new ToolPolicyResolver(toolConfig);
        this.readOnly = readOnly;
        this.filesystemBackend = filesystemBackend != null
                ? filesystemBackend
                : new LocalFilesystemBackend(filesystemSandbox, maxFileSizeMb == null ? DEFAULT_MAX_FILE_SIZE_MB : maxFileSizeMb);
        this.readTracker = new ReadTracker(
                path -> this.filesystemBackend.findStat(path)
                        .map(stat -> new ReadVersion(stat.getModifiedAtNanos(), stat.getSize())),
                maxTrackedOperations == null ? 1024 : maxTrackedOperations,
                readTrackingIdleTtl,
                clock);
    }

    public void init() {
        try {
            Files.createDirectories(filesystemSandbox.getRoot());
            Files.createDirectories(sandboxCwdSandbox.getRoot());
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to create workspace roots for " + id, e);
        }
        log.info("workspace.init id={} fsRoot={} sandboxRoot={} timeoutMs={} readOnly={}",
                id, filesystemSandbox.getRoot(), sandboxCwdSandbox.getRoot(), operationTimeoutMs, readOnly);
    }

    public void destroy() {
        readTracker.clear();
        log.info("workspace.destroy id={}", id);
    }

    public String getId() {
        return id;
    }

    public long getOperationTimeoutMs() {
        return operationTimeoutMs;
    }

    public Path getFilesystemRootDir() {
        return filesystemSandbox.getRoot();
    }

    public Path getSandboxRootDir() {
        return sandboxCwdSandbox.getRoot();
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Fails with {@link ReadOnlyWorkspaceException} when the filesystem is read-only.
     */
    public void ensureWritable() {
        if (readOnly) {
            throw new ReadOnlyWorkspaceException(id);
        }
    }

    public FilesystemBackend getFilesystemBackend() {
        return filesystemBackend;
    }

    public ToolPolicy getPolicy(String toolkit, String toolName) {
        return policyResolver.policyFor(toolkit, toolName);
    }

    public OperationKey getOperationKey(String operationId, String conversationId, String toolCallId) {
        return OperationKey.of(operationId, conversationId, toolCallId);
    }

    public void recordRead(OperationKey operationKey, String workspacePath) {
        readTracker.recordRead(operationKey, normalizeWorkspacePath(workspacePath));
    }

    public void assertReadBeforeWrite(OperationKey operationKey, String workspacePath) {
        readTracker.assertReadBeforeWrite(operationKey, normalizeWorkspacePath(workspacePath));
    }

    public void refreshAfterWrite(OperationKey operationKey, String workspacePath) {
        readTracker.refreshAfterWrite(operationKey, normalizeWorkspacePath(workspacePath));
    }

    public String normalizeWorkspacePath(String inputPath) {
        return PathSandbox.normalize(inputPath);
    }

    public Path resolveWorkspacePathToHost(String workspacePath) {
        return filesystemSandbox.resolveToHost(workspacePath);
    }

    public Path resolveSandboxCwd(String workspaceCwd) {
        if (workspaceCwd == null || workspaceCwd.isBlank()) {
            return sandboxCwdSandbox.getRoot();
        }
        return sandboxCwdSandbox.resolveToHost(workspaceCwd);
    }

    ReadTracker getReadTracker() {
        return readTracker;
    }
}
