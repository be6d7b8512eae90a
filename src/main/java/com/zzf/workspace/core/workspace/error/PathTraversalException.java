package com.zzf.workspace.core.workspace.error;

public class PathTraversalException extends WorkspaceException {
    public PathTraversalException(String rawPath) {
        super("path_traversal", "Path traversal not allowed: " + rawPath, false);
    }
}
