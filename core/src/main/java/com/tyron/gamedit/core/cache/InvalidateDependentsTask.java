package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ResourceValidity;

import java.util.Set;
import java.util.logging.Logger;

/**
 * Condemns every resource that used a deleted resource.
 * <p>
 * Must run before the graph is rebuilt: the used-by edges of the deleted id only exist in the
 * graph as it stood before the delete.
 */
final class InvalidateDependentsTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(InvalidateDependentsTask.class.getName());

    private final ValidationEngine engine;
    private final String resourceId;

    InvalidateDependentsTask(CacheState state, ValidationEngine engine, String resourceId) {
        super(state, "InvalidateCacheResource", "Invalidate resources using a deleted resource. [id=" + resourceId + "]");
        this.engine = engine;
        this.resourceId = resourceId;
    }

    @Override
    protected void doTask() {
        PropagationWave wave = new PropagationWave(resourceId);
        int invalidated = 0;
        try (CacheState.Locked locked = state.lock()) {
            Set<String> users = locked.graph().findUsedBy(resourceId);
            if (users != null) {
                for (String userId : users) {
                    Resource user = locked.resources().get(userId);
                    if (user == null || !wave.enqueue(userId)) {
                        continue;
                    }
                    ResourceValidity.store(user, ResourceValidity.INVALID);
                    locked.enqueueSubmission(new ValidateResourceTask(state, engine, userId, wave));
                    invalidated++;
                }
            }
        }
        final int count = invalidated;
        LOG.fine(() -> "Invalidated dependents of deleted resource. [id=" + resourceId + ", count=" + count + "]");
    }
}
