package com.zzf.workspace.core.workspace.error;

public class OperationCancelledException extends WorkspaceException {
    public OperationCancelledException() {
        this("Operation has been cancelled");
    }

    public OperationCancelledException(String message) {
        super("cancelled", message, false);
    }
}
