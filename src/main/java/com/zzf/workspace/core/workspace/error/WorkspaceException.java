package com.zzf.workspace.core.workspace.error;

/**
 * Root of every failure raised by the workspace runtime and its tools.
 * <p>
 * The {@link #getCode() code} is stable and is what the tool surface reports to the
 * orchestration layer; {@link #isRecoverable()} tells the caller whether a retry after
 * corrective action (re-read, smaller input) can succeed.
 */
public class WorkspaceException extends RuntimeException {
    private final String code;
    private final boolean recoverable;

    public WorkspaceException(String code, String message, boolean recoverable) {
        super(message);
        this.code = code;
        this.recoverable = recoverable;
    }

    public WorkspaceException(String code, String message, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.recoverable = recoverable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Short instruction for the agent, empty when there is nothing useful to say.
     */
    public String getHint() {
        return "";
    }
}
