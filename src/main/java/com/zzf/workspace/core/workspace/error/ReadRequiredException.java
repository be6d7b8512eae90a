package com.zzf.workspace.core.workspace.error;

public class ReadRequiredException extends WorkspaceException {
    public ReadRequiredException(String workspacePath) {
        super("read_required", "Read-before-write required for " + workspacePath + ". Call read_file first.", true);
    }

    @Override
    public String getHint() {
        return "Read the file with read_file in this operation, then retry.";
    }
}
