package com.zzf.workspace.core.sandbox;

/**
 * Runs one shell command to completion. Implementations never throw for process
 * failures; they are reported through {@link CommandResult}.
 */
public interface CommandExecutor {

    CommandResult execute(CommandRequest request);
}
