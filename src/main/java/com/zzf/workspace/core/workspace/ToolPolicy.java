package com.zzf.workspace.core.workspace;

import lombok.Value;

/**
 * Effective policy of one tool after defaults and overrides are merged.
 */
@Value
public class ToolPolicy {
    public static final ToolPolicy NONE = new ToolPolicy(false, false, false);

    boolean enabled;
    boolean needsApproval;
    boolean requireReadBeforeWrite;
}
