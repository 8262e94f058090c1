package com.tyron.gamedit.api.workspace;

import java.io.File;

/**
 * An open editor workspace: a directory holding the project's content and settings.
 */
public interface Workspace {

    /**
     * @return The display name of the workspace.
     */
    String getName();

    /**
     * @return The root directory; {@code ws://} URIs are resolved against it.
     */
    File getWorkspaceDirectory();

    /**
     * @return The configuration provider for this workspace.
     */
    WorkspaceConfiguration getConfiguration();

    /**
     * @return true while the workspace is open.
     */
    boolean isOpen();

    /**
     * Generic configuration wrapper (Key-Value store).
     */
    interface WorkspaceConfiguration {
        String getProperty(String key);

        String getProperty(String key, String defaultValue);

        void setProperty(String key, String value);
    }
}
