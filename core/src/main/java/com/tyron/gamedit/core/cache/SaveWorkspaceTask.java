package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.workspace.StorageResult;
import com.tyron.gamedit.api.workspace.WorkspaceStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Persists the cached resources and settings.
 * <p>
 * Copies are taken under the lock and written after releasing it. A failed write only marks
 * this task as failed; validity state is never touched.
 */
final class SaveWorkspaceTask extends CacheTask {

    private static final Logger LOG = Logger.getLogger(SaveWorkspaceTask.class.getName());

    private final WorkspaceStorage storage;
    private final Map<String, Object> workspaceProperties;
    private final Map<String, Object> userProperties;

    private volatile StorageResult result;

    SaveWorkspaceTask(CacheState state,
                      WorkspaceStorage storage,
                      Map<String, Object> workspaceProperties,
                      Map<String, Object> userProperties) {
        super(state, "SaveWorkspace", "Save project workspace.");
        this.storage = storage;
        this.workspaceProperties = workspaceProperties;
        this.userProperties = userProperties;
    }

    StorageResult getResult() {
        return result;
    }

    @Override
    protected void doTask() {
        long start = System.nanoTime();

        List<Resource> snapshot;
        ProjectSettings settings;
        try (CacheState.Locked locked = state.lock()) {
            snapshot = new ArrayList<>(locked.resources().size());
            for (Resource resource : locked.resources().values()) {
                snapshot.add(resource.copy());
            }
            settings = locked.settings().copy();
        }

        StorageResult saved = storage.save(snapshot, settings, workspaceProperties, userProperties);
        result = saved;
        if (!saved.isSuccess()) {
            setError(saved.getMessage());
            return;
        }

        long ms = (System.nanoTime() - start) / 1_000_000L;
        LOG.info("Workspace save took " + ms + "ms. [resources=" + snapshot.size() + "]");
    }
}
