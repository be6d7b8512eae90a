package com.zzf.workspace.core.workspace;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolPolicyResolverTest {

    @Test
    void missingConfigurationYieldsAllFalse() {
        ToolPolicyResolver resolver = new ToolPolicyResolver(null);

        assertEquals(ToolPolicy.NONE, resolver.policyFor("filesystem", "read_file"));
    }

    @Test
    void unknownToolkitYieldsAllFalse() {
        ToolPolicyResolver resolver = new ToolPolicyResolver(Map.of("search", toolkit(new ToolPolicyConfig(true, null, null))));

        assertEquals(ToolPolicy.NONE, resolver.policyFor("filesystem", "read_file"));
    }

    @Test
    void toolWithoutOverrideUsesDefaults() {
        ToolPolicyResolver resolver = new ToolPolicyResolver(Map.of("filesystem", toolkit(new ToolPolicyConfig(true, false, null))));

        ToolPolicy policy = resolver.policyFor("filesystem", "ls");

        assertTrue(policy.isEnabled());
        assertFalse(policy.isNeedsApproval());
        assertFalse(policy.isRequireReadBeforeWrite());
    }

    @Test
    void overrideWinsFieldByField() {
        ToolkitPolicies filesystem = toolkit(new ToolPolicyConfig(true, false, null));
        filesystem.getTools().put("edit_file", new ToolPolicyConfig(null, true, true));
        ToolPolicyResolver resolver = new ToolPolicyResolver(Map.of("filesystem", filesystem));

        ToolPolicy policy = resolver.policyFor("filesystem", "edit_file");

        assertTrue(policy.isEnabled());
        assertTrue(policy.isNeedsApproval());
        assertTrue(policy.isRequireReadBeforeWrite());
    }

    @Test
    void overrideCanDisableToolEnabledByDefault() {
        ToolkitPolicies filesystem = toolkit(new ToolPolicyConfig(true, null, null));
        filesystem.getTools().put("delete_file", new ToolPolicyConfig(false, null, null));
        ToolPolicyResolver resolver = new ToolPolicyResolver(Map.of("filesystem", filesystem));

        assertFalse(resolver.policyFor("filesystem", "delete_file").isEnabled());
        assertTrue(resolver.policyFor("filesystem", "write_file").isEnabled());
    }

    private static ToolkitPolicies toolkit(ToolPolicyConfig defaults) {
        ToolkitPolicies policies = new ToolkitPolicies();
        policies.setDefaults(defaults);
        return policies;
    }
}
