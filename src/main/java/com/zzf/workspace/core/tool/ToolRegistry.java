package com.zzf.workspace.core.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools by id, in registration order. Filled once at startup and read-only afterwards.
 */
public final class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public ToolRegistry(Collection<? extends Tool> tools) {
        if (tools != null) {
            tools.forEach(this::register);
        }
    }

    private void register(Tool tool) {
        if (tool == null || tool.getId() == null || tool.getId().isBlank()) {
            return;
        }
        Tool previous = tools.putIfAbsent(tool.getId(), tool);
        if (previous != null && previous != tool) {
            throw new IllegalStateException("Duplicate tool id: " + tool.getId());
        }
    }

    public Optional<Tool> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name.trim()));
    }

    public List<Tool> list() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }
}
