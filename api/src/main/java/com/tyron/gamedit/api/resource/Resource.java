package com.tyron.gamedit.api.resource;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * A uniquely identified piece of user content tracked by the editor.
 * <p>
 * The resource itself knows what it depends on; the cache only consumes these capabilities
 * and never interprets the content.
 *
 * <b>Threading:</b> instances handed to the resource cache are owned by it and are only
 * touched by cache tasks while the cache state lock is held. Callers must pass a {@link #copy()}.
 */
public interface Resource {

    /**
     * @return the unique, immutable identifier of this resource.
     */
    @NotNull
    String getId();

    /**
     * @return the user visible name.
     */
    @NotNull
    String getName();

    @NotNull
    ResourceType getType();

    /**
     * Primitive resources are built into every workspace. They never have dependencies or
     * file references and are valid by definition.
     */
    boolean isPrimitive();

    /**
     * @return ids of the resources this resource refers to. Never null, possibly empty.
     */
    @NotNull
    Set<String> listDependencies();

    /**
     * @return URIs of the external files (textures, scripts, audio, tile data) this resource reads.
     */
    @NotNull
    Set<String> collectFileReferences();

    boolean hasProperty(@NotNull String key);

    @Nullable
    Object getProperty(@NotNull String key);

    void setProperty(@NotNull String key, @NotNull Object value);

    void deleteProperty(@NotNull String key);

    /**
     * @return snapshot of the workspace-level property bag (persisted to the shared workspace file).
     */
    @NotNull
    Map<String, Object> getProperties();

    /**
     * @return snapshot of the per-user property bag (persisted to the private workspace file).
     */
    @NotNull
    Map<String, Object> getUserProperties();

    /**
     * @return the serialized content body as plain maps/lists/scalars.
     */
    @NotNull
    Map<String, Object> toContent();

    /**
     * @return an independent deep copy with the same id.
     */
    @NotNull
    Resource copy();
}
