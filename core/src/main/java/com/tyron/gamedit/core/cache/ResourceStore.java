package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resources tracked by the cache, keyed by id. Iteration follows insertion order.
 * <p>
 * Not thread-safe; only reachable through {@link CacheState.Locked}.
 */
public final class ResourceStore {

    private final Map<String, Resource> resources = new LinkedHashMap<>();

    /**
     * Inserts or replaces the resource stored under {@code id}.
     */
    public void insert(@NotNull String id, @NotNull Resource resource) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resource, "resource");
        if (!id.equals(resource.getId())) {
            throw new IllegalArgumentException("Resource id mismatch: key=" + id + " resource=" + resource.getId());
        }
        resources.put(id, resource);
    }

    /**
     * @return the removed resource, or null if nothing was stored under the id.
     */
    @Nullable
    public Resource remove(@NotNull String id) {
        return resources.remove(id);
    }

    @Nullable
    public Resource get(@NotNull String id) {
        return resources.get(id);
    }

    public boolean contains(@NotNull String id) {
        return resources.containsKey(id);
    }

    @NotNull
    public Set<String> ids() {
        return Collections.unmodifiableSet(resources.keySet());
    }

    @NotNull
    public Collection<Resource> values() {
        return Collections.unmodifiableCollection(resources.values());
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
