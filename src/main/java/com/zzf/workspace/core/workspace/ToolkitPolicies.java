package com.zzf.workspace.core.workspace;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class ToolkitPolicies {
    private ToolPolicyConfig defaults;
    private Map<String, ToolPolicyConfig> tools = new LinkedHashMap<>();
}
