package com.plang.ir;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compiled policy set: an ordered mapping from policy identifier to function.
 * <p>
 * Immutable and safe to share between threads once built. Uses identity equality so it
 * can key per-module caches.
 */
public final class IrModule {

    private final Map<String, IrFunction> functions;

    public IrModule(List<IrFunction> functions) {
        Map<String, IrFunction> ordered = new LinkedHashMap<>();
        for (IrFunction function : functions) {
            if (ordered.put(function.id(), function) != null) {
                throw new IllegalArgumentException("Duplicate policy id: " + function.id());
            }
        }
        this.functions = Collections.unmodifiableMap(ordered);
    }

    public Optional<IrFunction> get(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    public boolean contains(String id) {
        return functions.containsKey(id);
    }

    /**
     * Functions in declaration order.
     */
    public Collection<IrFunction> functions() {
        return functions.values();
    }

    public List<String> ids() {
        return List.copyOf(functions.keySet());
    }

    public int size() {
        return functions.size();
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    /**
     * Copy of this module with some priorities replaced. Order and everything else is kept.
     *
     * @param priorities New priority per policy id; ids not present keep theirs
     */
    public IrModule withPriorities(Map<String, Integer> priorities) {
        if (priorities.isEmpty()) {
            return this;
        }
        List<IrFunction> updated = functions.values().stream()
                .map(f -> priorities.containsKey(f.id())
                        ? f.withMetadata(f.metadata().withPriority(priorities.get(f.id())))
                        : f)
                .toList();
        return new IrModule(updated);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (IrFunction function : functions.values()) {
            sb.append(function.render());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "IrModule" + functions.keySet();
    }
}
