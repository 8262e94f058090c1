package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.Resource;

import java.util.logging.Logger;

final class AddResourceTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(AddResourceTask.class.getName());

    private final String resourceId;
    private final Resource resource;

    AddResourceTask(CacheState state, String resourceId, Resource resource) {
        super(state, "AddCacheResource", "Add resource to cache. [id=" + resourceId + "]");
        this.resourceId = resourceId;
        this.resource = resource;
    }

    @Override
    protected void doTask() {
        try (CacheState.Locked locked = state.lock()) {
            locked.resources().insert(resourceId, resource);
        }
        LOG.fine(() -> "Add resource to cache. [id=" + resourceId + "]");
    }
}
