package com.zzf.workspace.core.workspace.error;

public class StaleReadException extends WorkspaceException {
    private final boolean deleted;

    public StaleReadException(String workspacePath, boolean deleted) {
        super("stale_read", deleted
                ? "Read-before-write required for " + workspacePath + ". File no longer exists."
                : "Read-before-write required for " + workspacePath + ". File changed since last read; re-read it.", true);
        this.deleted = deleted;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public String getHint() {
        return "Re-read the file to pick up the current content, then retry.";
    }
}
