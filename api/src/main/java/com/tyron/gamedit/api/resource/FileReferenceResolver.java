package com.tyron.gamedit.api.resource;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * Maps a resource file URI (e.g. {@code ws://textures/a.png}) to a location on disk.
 */
@FunctionalInterface
public interface FileReferenceResolver {

    /**
     * @return the filesystem path, or null if the URI cannot be mapped at all.
     */
    @Nullable
    Path resolve(@NotNull String uri);
}
