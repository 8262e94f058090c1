package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reverse dependency edges: resource id -> ids of the resources that use it.
 * <p>
 * The graph is never patched. Whenever the resource set changes it is rebuilt from scratch
 * with {@link #rebuild(ResourceStore)} and swapped in as a whole.
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new DependencyGraph(Collections.emptyMap());

    private final Map<String, Set<String>> usedBy;

    private DependencyGraph(Map<String, Set<String>> usedBy) {
        this.usedBy = usedBy;
    }

    @NotNull
    public static DependencyGraph empty() {
        return EMPTY;
    }

    /**
     * Builds the graph for every resource in the store.
     * <p>
     * Each resource gets a node, even when nothing uses it. Dependencies are followed
     * transitively through non-primitive resources. Dangling dependency ids are skipped here;
     * the validator reports them.
     */
    @NotNull
    public static DependencyGraph rebuild(@NotNull ResourceStore store) {
        Map<String, Set<String>> usedBy = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<Resource> pending = new ArrayDeque<>();

        for (Resource root : store.values()) {
            pending.push(root);
            while (!pending.isEmpty()) {
                Resource resource = pending.pop();
                String id = resource.getId();
                if (!visited.add(id)) {
                    continue;
                }
                usedBy.computeIfAbsent(id, k -> new LinkedHashSet<>());

                for (String dependencyId : resource.listDependencies()) {
                    Resource dependency = store.get(dependencyId);
                    if (dependency == null) {
                        continue;
                    }
                    usedBy.computeIfAbsent(dependencyId, k -> new LinkedHashSet<>()).add(id);
                    if (!dependency.isPrimitive() && !visited.contains(dependencyId)) {
                        pending.push(dependency);
                    }
                }
            }
        }

        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        usedBy.forEach((id, users) -> frozen.put(id, Collections.unmodifiableSet(users)));
        return new DependencyGraph(Collections.unmodifiableMap(frozen));
    }

    public boolean hasNode(@NotNull String id) {
        return usedBy.containsKey(id);
    }

    /**
     * @return the ids that directly depend on {@code id}, or null if the graph has no node for it.
     */
    @Nullable
    public Set<String> findUsedBy(@NotNull String id) {
        return usedBy.get(id);
    }

    /**
     * Lookup for ids the cache knows are tracked.
     *
     * @throws IllegalStateException if the node is missing, which means the cache's own bookkeeping is broken.
     */
    @NotNull
    public Set<String> getUsedBy(@NotNull String id) {
        Set<String> users = usedBy.get(id);
        if (users == null) {
            throw new IllegalStateException("No dependency graph node for tracked resource: " + id);
        }
        return users;
    }

    @NotNull
    public Set<String> nodes() {
        return usedBy.keySet();
    }

    public int size() {
        return usedBy.size();
    }

    @Override
    public String toString() {
        return "DependencyGraph" + usedBy;
    }
}
