package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ResourceValidity;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rebuilds the reverse dependency graph from the current store and swaps it in.
 * <p>
 * In full sweep mode it also forgets every memoized verdict and queues a validation for each
 * non-primitive resource, after the new graph is in place.
 */
final class BuildGraphTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(BuildGraphTask.class.getName());

    private final ValidationEngine engine;
    private final boolean fullSweep;

    BuildGraphTask(CacheState state, ValidationEngine engine, boolean fullSweep) {
        super(state, "BuildCacheGraph", fullSweep
                ? "Build resource dependency graph and validate all resources."
                : "Build resource dependency graph.");
        this.engine = engine;
        this.fullSweep = fullSweep;
    }

    @Override
    protected void doTask() {
        long start = System.nanoTime();
        int nodes;
        int scheduled = 0;
        try (CacheState.Locked locked = state.lock()) {
            ResourceStore store = locked.resources();
            if (fullSweep) {
                for (Resource resource : store.values()) {
                    ResourceValidity.clear(resource);
                }
            }

            DependencyGraph graph = DependencyGraph.rebuild(store);
            locked.setGraph(graph);
            nodes = graph.size();

            if (fullSweep) {
                for (Resource resource : store.values()) {
                    if (resource.isPrimitive()) {
                        continue;
                    }
                    String id = resource.getId();
                    locked.enqueueSubmission(new ValidateResourceTask(state, engine, id, new PropagationWave(id)));
                    scheduled++;
                }
            }
        }
        if (LOG.isLoggable(Level.FINE)) {
            long ms = (System.nanoTime() - start) / 1_000_000L;
            LOG.fine("Built resource dependency graph. [nodes=" + nodes + ", validations=" + scheduled
                    + ", tookMs=" + ms + "]");
        }
    }
}
