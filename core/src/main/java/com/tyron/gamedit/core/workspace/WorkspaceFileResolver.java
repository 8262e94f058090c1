package com.tyron.gamedit.core.workspace;

import com.tyron.gamedit.api.resource.FileReferenceResolver;
import com.tyron.gamedit.api.workspace.Workspace;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Maps resource file URIs to disk locations.
 * <ul>
 *     <li>{@code ws://rel} - relative to the workspace directory</li>
 *     <li>{@code app://rel} - relative to the editor's application home</li>
 *     <li>{@code fs://abs} - an absolute filesystem path</li>
 *     <li>anything else - a plain path</li>
 * </ul>
 */
public final class WorkspaceFileResolver implements FileReferenceResolver {

    /**
     * Directory {@code app://} URIs resolve against. Defaults to the working directory.
     */
    public static final String APP_HOME_KEY = "gamedit.appHome";

    private static final String WORKSPACE_SCHEME = "ws://";
    private static final String APP_SCHEME = "app://";
    private static final String FILESYSTEM_SCHEME = "fs://";

    private final Path workspaceDir;
    private final Path appHome;

    public WorkspaceFileResolver(@NotNull Path workspaceDir, @NotNull Path appHome) {
        this.workspaceDir = Objects.requireNonNull(workspaceDir, "workspaceDir");
        this.appHome = Objects.requireNonNull(appHome, "appHome");
    }

    public static WorkspaceFileResolver forWorkspace(@NotNull Workspace workspace) {
        String home = workspace.getConfiguration().getProperty(APP_HOME_KEY);
        Path appHome = (home == null || home.isBlank()) ? Path.of("").toAbsolutePath() : Path.of(home.trim());
        return new WorkspaceFileResolver(workspace.getWorkspaceDirectory().toPath(), appHome);
    }

    @Override
    public @Nullable Path resolve(@NotNull String uri) {
        if (uri.isBlank()) {
            return null;
        }
        try {
            if (uri.startsWith(WORKSPACE_SCHEME)) {
                return workspaceDir.resolve(uri.substring(WORKSPACE_SCHEME.length()));
            }
            if (uri.startsWith(APP_SCHEME)) {
                return appHome.resolve(uri.substring(APP_SCHEME.length()));
            }
            if (uri.startsWith(FILESYSTEM_SCHEME)) {
                return Path.of(uri.substring(FILESYSTEM_SCHEME.length()));
            }
            return Path.of(uri);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    public Path getWorkspaceDir() {
        return workspaceDir;
    }

    public Path getAppHome() {
        return appHome;
    }
}
