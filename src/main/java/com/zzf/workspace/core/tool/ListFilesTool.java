package com.zzf.workspace.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.workspace.core.workspace.WorkspaceRuntime;
import org.springframework.stereotype.Component;

/**
 * Same listing as {@link ListTreeTool} under the name older agents ask for. Policies
 * are resolved by this tool's own id.
 */
@Component
public class ListFilesTool extends ListTreeTool {

    public ListFilesTool(WorkspaceRuntime workspace, ObjectMapper objectMapper) {
        super(workspace, objectMapper);
    }

    @Override
    public String getId() {
        return "list_files";
    }

    @Override
    protected String fallbackDescription() {
        return "Alias for list_tree: list files and directories recursively.";
    }
}
