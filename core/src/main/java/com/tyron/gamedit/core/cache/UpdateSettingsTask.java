package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.project.ProjectSettings;

import java.util.logging.Logger;

final class UpdateSettingsTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(UpdateSettingsTask.class.getName());

    private final ProjectSettings settings;

    UpdateSettingsTask(CacheState state, ProjectSettings settings) {
        super(state, "UpdateCacheSettings", "Update project settings in cache.");
        this.settings = settings;
    }

    @Override
    protected void doTask() {
        try (CacheState.Locked locked = state.lock()) {
            locked.setSettings(settings);
        }
        LOG.fine("Update project settings in cache.");
    }
}
