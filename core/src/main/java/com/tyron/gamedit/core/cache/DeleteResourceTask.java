package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;

import java.util.logging.Logger;

final class DeleteResourceTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(DeleteResourceTask.class.getName());

    private final String resourceId;

    DeleteResourceTask(CacheState state, String resourceId) {
        super(state, "DeleteCacheResource", "Delete resource from cache. [id=" + resourceId + "]");
        this.resourceId = resourceId;
    }

    @Override
    protected void doTask() {
        Resource removed;
        try (CacheState.Locked locked = state.lock()) {
            removed = locked.resources().remove(resourceId);
        }
        if (removed == null) {
            LOG.fine(() -> "Delete of unknown resource ignored. [id=" + resourceId + "]");
        } else {
            LOG.fine(() -> "Delete resource from cache. [id=" + resourceId + "]");
        }
    }
}
