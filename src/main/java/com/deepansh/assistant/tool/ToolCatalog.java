package com.deepansh.assistant.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of tool definitions keyed by name.
 */
public final class ToolCatalog {

    private static final ToolCatalog EMPTY = new ToolCatalog(List.of());

    private final Map<String, ToolDefinition> byName;

    private ToolCatalog(List<ToolDefinition> definitions) {
        Map<String, ToolDefinition> map = new LinkedHashMap<>();
        for (ToolDefinition def : definitions) {
            map.putIfAbsent(def.getName(), def);
        }
        this.byName = map;
    }

    public static ToolCatalog of(List<ToolDefinition> definitions) {
        return definitions == null || definitions.isEmpty() ? EMPTY : new ToolCatalog(definitions);
    }

    public static ToolCatalog empty() {
        return EMPTY;
    }

    public List<ToolDefinition> definitions() {
        return List.copyOf(byName.values());
    }

    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(byName.keySet()));
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    @Override
    public String toString() {
        return "ToolCatalog" + byName.keySet();
    }
}
