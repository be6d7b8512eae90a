package com.zzf.workspace.core.workspace.error;

public class PathEscapeException extends WorkspaceException {
    public PathEscapeException(String workspacePath, String rootName) {
        super("path_escape", "Path outside " + rootName + " root: " + workspacePath, false);
    }
}
