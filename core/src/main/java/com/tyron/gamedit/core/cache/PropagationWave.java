package com.tyron.gamedit.core.cache;

import org.jetbrains.annotations.NotNull;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One cascade of validity changes spreading from a single resource over its used-by edges.
 * <p>
 * The wave is the breadth-first frontier: the ids whose validate task has been queued but has
 * not run yet. A dependent already on the frontier is not queued twice; once its task runs it
 * leaves the frontier and may be queued again when another of its dependencies settles later.
 * <p>
 * Guarded by the cache state lock; only touched from tasks holding {@link CacheState.Locked}.
 */
public final class PropagationWave {

    private final String origin;
    private final Set<String> frontier = new HashSet<>();

    public PropagationWave(@NotNull String origin) {
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    /**
     * @return true if {@code id} was not waiting on the frontier and the caller must queue it.
     */
    public boolean enqueue(@NotNull String id) {
        return frontier.add(id);
    }

    /**
     * Called by the validate task of {@code id} when it starts.
     */
    public void settle(@NotNull String id) {
        frontier.remove(id);
    }

    @NotNull
    public String getOrigin() {
        return origin;
    }

    @Override
    public String toString() {
        return "PropagationWave[origin=" + origin + ", frontier=" + frontier.size() + "]";
    }
}
