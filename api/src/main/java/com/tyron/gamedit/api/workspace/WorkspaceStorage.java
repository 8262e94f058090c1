package com.tyron.gamedit.api.workspace;

import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.Resource;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Map;

/**
 * Durable storage for workspace content. Write-only from the cache's point of view;
 * loading is done by a separate path when the workspace is opened.
 */
public interface WorkspaceStorage {

    /**
     * Writes all resources and settings.
     *
     * <b>Threading:</b> called from a cache worker after the cache state lock was released.
     * The resources are copies; implementations must not call back into the cache.
     *
     * @param resources           copies of every resource in the cache, primitives included
     * @param settings            project settings snapshot
     * @param workspaceProperties shared workspace properties
     * @param userProperties      private, per-user workspace properties
     */
    @NotNull
    StorageResult save(@NotNull Collection<? extends Resource> resources,
                       @NotNull ProjectSettings settings,
                       @NotNull Map<String, Object> workspaceProperties,
                       @NotNull Map<String, Object> userProperties);
}
