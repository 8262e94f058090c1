package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.resource.FileReferenceResolver;
import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ResourceValidity;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether a resource is valid and how a verdict spreads to the resources using it.
 * <p>
 * A resource is valid when every resource it depends on exists and is valid and every file it
 * references exists. Verdicts are memoized on the resource ({@link ResourceValidity}); a resource
 * is only recomputed after it was freshly added or explicitly invalidated.
 * <p>
 * Callers must hold the cache state lock.
 */
public final class ValidationEngine {

    private static final Logger LOG = Logger.getLogger(ValidationEngine.class.getName());

    private final FileReferenceResolver fileResolver;

    public ValidationEngine(@NotNull FileReferenceResolver fileResolver) {
        this.fileResolver = Objects.requireNonNull(fileResolver, "fileResolver");
    }

    /**
     * @return true if the resource is valid. A missing id is a broken reference and yields false.
     */
    public boolean validate(@NotNull ResourceStore store, @NotNull String id) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(id, "id");
        return validate(store, id, new HashSet<>());
    }

    private boolean validate(ResourceStore store, String id, Set<String> inProgress) {
        Resource resource = store.get(id);
        if (resource == null) {
            LOG.fine(() -> "Resource not found. [id=" + id + "]");
            return false;
        }
        if (resource.isPrimitive()) {
            return true;
        }

        ResourceValidity cached = ResourceValidity.of(resource);
        if (cached.isKnown()) {
            return cached == ResourceValidity.VALID;
        }

        // a resource reached again while its own dependencies are still being checked
        // depends on itself
        if (!inProgress.add(id)) {
            LOG.fine(() -> "Dependency cycle. [id=" + id + "]");
            return false;
        }
        try {
            for (String dependencyId : resource.listDependencies()) {
                if (!validate(store, dependencyId, inProgress)) {
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Resource has a broken dependency. [id=" + id + ", dependency=" + dependencyId + "]");
                    }
                    ResourceValidity.store(resource, ResourceValidity.INVALID);
                    return false;
                }
            }

            for (String uri : resource.collectFileReferences()) {
                if (!fileExists(uri)) {
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("Resource file reference is missing. [id=" + id + ", uri='" + uri + "']");
                    }
                    ResourceValidity.store(resource, ResourceValidity.INVALID);
                    return false;
                }
            }
        } finally {
            inProgress.remove(id);
        }

        ResourceValidity.store(resource, ResourceValidity.VALID);
        return true;
    }

    /**
     * Pushes the verdict for {@code id} one step along its used-by edges.
     * <p>
     * A valid resource clears the memoized verdict of its dependents, which may still be broken
     * for other reasons. An invalid resource condemns its dependents directly; a dependent that is
     * already invalid is left alone, since its own cascade has been scheduled before. Every touched
     * dependent not already waiting on the {@code wave} frontier is handed to {@code schedule} so
     * that its own dependents are visited in turn.
     *
     * @return number of dependents scheduled
     */
    public int propagate(@NotNull CacheState.Locked state,
                         @NotNull String id,
                         boolean valid,
                         @NotNull PropagationWave wave,
                         @NotNull Consumer<String> schedule) {
        ResourceStore store = state.resources();
        DependencyGraph graph = state.graph();

        Set<String> users = store.contains(id) ? graph.getUsedBy(id) : graph.findUsedBy(id);
        if (users == null || users.isEmpty()) {
            return 0;
        }

        int scheduled = 0;
        for (String userId : users) {
            Resource user = store.get(userId);
            // edge from a stale graph to a resource that is gone already
            if (user == null) {
                continue;
            }
            if (!valid && ResourceValidity.of(user) == ResourceValidity.INVALID) {
                continue;
            }
            ResourceValidity.store(user, valid ? ResourceValidity.UNKNOWN : ResourceValidity.INVALID);
            if (wave.enqueue(userId)) {
                schedule.accept(userId);
                scheduled++;
            }
        }
        return scheduled;
    }

    private boolean fileExists(String uri) {
        if (uri == null || uri.isBlank()) {
            return false;
        }
        Path path;
        try {
            path = fileResolver.resolve(uri);
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Failed to resolve file reference '" + uri + "'", e);
            return false;
        }
        return path != null && Files.exists(path);
    }
}
