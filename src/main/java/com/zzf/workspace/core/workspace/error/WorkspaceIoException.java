package com.zzf.workspace.core.workspace.error;

import java.io.IOException;

/**
 * Backend I/O failure. Propagated as-is; retrying is up to the caller.
 */
public class WorkspaceIoException extends WorkspaceException {
    public WorkspaceIoException(String message) {
        super("io_error", message, true);
    }

    public WorkspaceIoException(String message, IOException cause) {
        super("io_error", message + ": " + cause.getMessage(), true, cause);
    }
}
