package com.zzf.workspace.core.workspace;

import com.zzf.workspace.core.workspace.error.PathEscapeException;
import com.zzf.workspace.core.workspace.error.PathTraversalException;
import com.zzf.workspace.core.workspace.error.WorkspaceIoException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Maps virtual workspace paths ({@code /docs/a.md}) onto a host directory and refuses
 * anything that would leave it. One instance per root: the runtime keeps one for the
 * filesystem and one for the sandbox working directory.
 */
public final class PathSandbox {
    private final Path root;
    private final String rootName;

    public PathSandbox(Path root, String rootName) {
        if (root == null) {
            throw new IllegalArgumentException("root is null");
        }
        this.root = root.toAbsolutePath().normalize();
        this.rootName = rootName == null || rootName.isBlank() ? "workspace" : rootName.trim();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Canonical workspace form: leading slash, forward slashes, no empty or {@code .}
     * segments, no trailing slash, no {@code ..}, no {@code ~}. Read tracking and the
     * search index key on this string, so equivalent spellings must collapse to one.
     */
    public static String normalize(String rawPath) {
        String raw = rawPath == null ? "" : rawPath.trim().replace('\\', '/');
        if (raw.startsWith("~")) {
            throw new PathTraversalException(rawPath);
        }
        String withSlash = raw.startsWith("/") ? raw : "/" + raw;
        if (withSlash.contains("..") || withSlash.startsWith("/~")) {
            throw new PathTraversalException(rawPath);
        }
        StringBuilder out = new StringBuilder();
        for (String segment : withSlash.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            out.append('/').append(segment);
        }
        return out.length() == 0 ? "/" : out.toString();
    }

    public Path resolveToHost(String workspacePath) {
        String normalized = normalize(workspacePath);
        String rel = "/".equals(normalized) ? "" : normalized.substring(1);
        Path full = root.resolve(rel).normalize();
        Path relativeToRoot = root.relativize(full);
        if (relativeToRoot.isAbsolute() || relativeToRoot.startsWith("..")) {
            throw new PathEscapeException(normalized, rootName);
        }
        if (Files.exists(full, LinkOption.NOFOLLOW_LINKS)) {
            ensureRealPathInside(full, normalized);
        }
        return full;
    }

    /**
     * Inverse of {@link #resolveToHost(String)} for paths found by walking the root.
     */
    public String toWorkspacePath(Path hostPath) {
        Path normalized = hostPath.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new PathEscapeException(normalized.toString(), rootName);
        }
        String rel = root.relativize(normalized).toString().replace('\\', '/');
        return rel.isEmpty() ? "/" : "/" + rel;
    }

    private void ensureRealPathInside(Path full, String workspacePath) {
        try {
            Path realRoot = Files.exists(root) ? root.toRealPath() : root;
            Path realFull = full.toRealPath();
            if (!realFull.startsWith(realRoot)) {
                throw new PathEscapeException(workspacePath, rootName);
            }
        } catch (IOException e) {
            throw new WorkspaceIoException("Failed to resolve " + workspacePath, e);
        }
    }
}
