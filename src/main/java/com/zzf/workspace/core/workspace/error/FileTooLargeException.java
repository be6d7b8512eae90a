package com.zzf.workspace.core.workspace.error;

public class FileTooLargeException extends WorkspaceException {
    public FileTooLargeException(String workspacePath, long sizeBytes, long maxBytes) {
        super("file_too_large", "File " + workspacePath + " is " + sizeBytes + " bytes (max " + maxBytes + ")", false);
    }
}
