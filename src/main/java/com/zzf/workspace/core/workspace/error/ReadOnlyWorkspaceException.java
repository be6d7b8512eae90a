package com.zzf.workspace.core.workspace.error;

public class ReadOnlyWorkspaceException extends WorkspaceException {
    public ReadOnlyWorkspaceException(String workspaceId) {
        super("read_only", "Workspace filesystem is read-only: " + workspaceId, false);
    }
}
