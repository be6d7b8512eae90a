package com.zzf.workspace.core.workspace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merges toolkit defaults with per-tool overrides, field by field. One level only, no
 * wildcards. Missing configuration yields {@link ToolPolicy#NONE}.
 */
public final class ToolPolicyResolver {
    private final Map<String, ToolkitPolicies> toolkits;

    public ToolPolicyResolver(Map<String, ToolkitPolicies> toolkits) {
        this.toolkits = toolkits == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(toolkits));
    }

    public ToolPolicy policyFor(String toolkitName, String toolName) {
        ToolkitPolicies toolkit = toolkitName == null ? null : toolkits.get(toolkitName);
        if (toolkit == null) {
            return ToolPolicy.NONE;
        }
        ToolPolicyConfig defaults = toolkit.getDefaults();
        ToolPolicyConfig override = toolkit.getTools() == null || toolName == null ? null : toolkit.getTools().get(toolName);
        return new ToolPolicy(
                pick(override == null ? null : override.getEnabled(), defaults == null ? null : defaults.getEnabled()),
                pick(override == null ? null : override.getNeedsApproval(), defaults == null ? null : defaults.getNeedsApproval()),
                pick(override == null ? null : override.getRequireReadBeforeWrite(), defaults == null ? null : defaults.getRequireReadBeforeWrite())
        );
    }

    private static boolean pick(Boolean override, Boolean fallback) {
        if (override != null) {
            return override;
        }
        return fallback != null && fallback;
    }
}
