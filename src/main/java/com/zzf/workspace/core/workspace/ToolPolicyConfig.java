package com.zzf.workspace.core.workspace;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One configured policy entry. Unset fields mean "inherit" when used as a per-tool
 * override and "false" when used as toolkit defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolPolicyConfig {
    private Boolean enabled;
    private Boolean needsApproval;
    private Boolean requireReadBeforeWrite;
}
