package com.zzf.workspace.core.workspace.error;

public class InvalidToolArgumentsException extends WorkspaceException {
    public InvalidToolArgumentsException(String message) {
        super("invalid_arguments", message, true);
    }
}
