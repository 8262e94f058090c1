package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.concurrent.TaskExecutor;
import com.tyron.gamedit.api.concurrent.TaskHandle;
import com.tyron.gamedit.api.concurrent.WorkerTask;
import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.FileReferenceResolver;
import com.tyron.gamedit.api.resource.Resource;
import com.tyron.gamedit.api.resource.ResourceValidity;
import com.tyron.gamedit.api.resource.ValidationReport;
import com.tyron.gamedit.api.service.Disposable;
import com.tyron.gamedit.api.workspace.Workspace;
import com.tyron.gamedit.api.workspace.WorkspaceStorage;
import com.tyron.gamedit.core.workspace.WorkspaceFileResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the workspace's resources and their validity known while the user edits them.
 * <p>
 * <b>Threading:</b> every public method is called from the owner thread (typically the UI
 * thread). Work is packaged into tasks and handed to the {@link TaskExecutor}; tasks spawned by
 * other tasks are buffered and forwarded by {@link #tickPendingWork()}, which the owner calls
 * periodically together with {@link #dequeuePendingUpdates(Collection)}. Nothing here blocks.
 * <p>
 * Typical usage:
 * <pre>
 * cache.addResource(resource.getId(), resource.copy());
 * cache.buildCache();
 * // on every UI tick
 * cache.tickPendingWork();
 * cache.dequeuePendingUpdates(reports);
 * </pre>
 */
public final class ResourceCache implements Disposable {

    private static final Logger LOG = Logger.getLogger(ResourceCache.class.getName());

    /**
     * Upper bound of child tasks forwarded to the executor per tick. Defaults to unlimited.
     */
    public static final String MAX_SUBMIT_PER_TICK_KEY = "gamedit.cache.maxSubmitPerTick";

    private final TaskExecutor executor;
    private final WorkspaceStorage storage;
    private final ValidationEngine engine;
    private final CacheState state = new CacheState();
    private final int maxSubmitPerTick;
    private final Thread owner;

    // handles in submission order; only touched by the owner thread
    private final Deque<TaskHandle> pendingWork = new ArrayDeque<>();

    private CacheLifecycle lifecycle = CacheLifecycle.UNINITIALIZED;

    public ResourceCache(@NotNull TaskExecutor executor,
                         @NotNull FileReferenceResolver fileResolver,
                         @NotNull WorkspaceStorage storage) {
        this(executor, fileResolver, storage, Integer.MAX_VALUE);
    }

    public ResourceCache(@NotNull TaskExecutor executor,
                         @NotNull FileReferenceResolver fileResolver,
                         @NotNull WorkspaceStorage storage,
                         int maxSubmitPerTick) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.engine = new ValidationEngine(Objects.requireNonNull(fileResolver, "fileResolver"));
        if (maxSubmitPerTick <= 0) {
            throw new IllegalArgumentException("maxSubmitPerTick must be positive: " + maxSubmitPerTick);
        }
        this.maxSubmitPerTick = maxSubmitPerTick;
        this.owner = Thread.currentThread();
    }

    /**
     * Creates a cache configured from the workspace configuration.
     */
    public static ResourceCache create(@NotNull Workspace workspace,
                                       @NotNull TaskExecutor executor,
                                       @NotNull WorkspaceStorage storage) {
        Objects.requireNonNull(workspace, "workspace");
        int maxSubmit = (int) Math.max(1, Math.min(Integer.MAX_VALUE,
                readLongConfig(workspace, MAX_SUBMIT_PER_TICK_KEY, Integer.MAX_VALUE)));
        return new ResourceCache(executor, WorkspaceFileResolver.forWorkspace(workspace), storage, maxSubmit);
    }

    /**
     * Adds a resource, replacing any resource with the same id.
     * <p>
     * The cache takes ownership of {@code resource}; pass a copy. Its memoized validity is
     * cleared so a verdict from an earlier resource with the same id is never reused.
     */
    public void addResource(@NotNull String id, @NotNull Resource resource) {
        checkOwnerThread();
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(resource, "resource");
        if (!id.equals(resource.getId())) {
            throw new IllegalArgumentException("Resource id mismatch: id=" + id + " resource=" + resource.getId());
        }
        ResourceValidity.clear(resource);

        submit(new AddResourceTask(state, id, resource));

        if (lifecycle == CacheLifecycle.INITIALIZED) {
            submit(new BuildGraphTask(state, engine, false));
            submit(new ValidateResourceTask(state, engine, id, new PropagationWave(id)));
        }
    }

    public void addResource(@NotNull Resource resource) {
        addResource(resource.getId(), resource);
    }

    /**
     * Removes a resource. Once the graph exists, everything that used it becomes invalid.
     */
    public void deleteResource(@NotNull String id) {
        checkOwnerThread();
        Objects.requireNonNull(id, "id");

        submit(new DeleteResourceTask(state, id));

        if (lifecycle == CacheLifecycle.INITIALIZED) {
            // dependents are read from the graph before the rebuild drops the deleted node
            submit(new InvalidateDependentsTask(state, engine, id));
            submit(new BuildGraphTask(state, engine, false));
        }
    }

    public void updateSettings(@NotNull ProjectSettings settings) {
        checkOwnerThread();
        Objects.requireNonNull(settings, "settings");
        submit(new UpdateSettingsTask(state, settings.copy()));
    }

    /**
     * Persists the current resources and settings through the configured storage.
     */
    public void saveWorkspace(@NotNull Map<String, Object> workspaceProperties,
                              @NotNull Map<String, Object> userProperties) {
        checkOwnerThread();
        Objects.requireNonNull(workspaceProperties, "workspaceProperties");
        Objects.requireNonNull(userProperties, "userProperties");
        submit(new SaveWorkspaceTask(state, storage,
                new LinkedHashMap<>(workspaceProperties), new LinkedHashMap<>(userProperties)));
    }

    /**
     * Rebuilds the dependency graph and validates every non-primitive resource from scratch.
     * <p>
     * The validations are queued by the rebuild task itself once the new graph is in place,
     * so they see every add and delete submitted before this call. Calling it again is a
     * full retry.
     */
    public void buildCache() {
        checkOwnerThread();
        submit(new BuildGraphTask(state, engine, true));
        lifecycle = CacheLifecycle.INITIALIZED;
        LOG.fine("Build resource cache.");
    }

    /**
     * Forwards child tasks to the executor and retires completed work in submission order.
     * <p>
     * If a task is busy with the state lock the forwarding step is skipped until the next tick.
     */
    public void tickPendingWork() {
        checkOwnerThread();

        List<WorkerTask> submissions = List.of();
        try (CacheState.Locked locked = state.tryLock()) {
            if (locked != null) {
                submissions = locked.takeSubmissions(maxSubmitPerTick);
            }
        }
        for (WorkerTask task : submissions) {
            submit(task);
        }

        while (!pendingWork.isEmpty()) {
            TaskHandle handle = pendingWork.peekFirst();
            if (!handle.isComplete()) {
                return;
            }
            pendingWork.pollFirst();

            WorkerTask task = handle.getTask();
            if (task.hasError()) {
                if (task.getError() != null) {
                    LOG.log(Level.WARNING, "Task failed: " + task.getTaskName() + " - " + task.getErrorMessage(), task.getError());
                } else {
                    LOG.warning("Task failed: " + task.getTaskName() + " - " + task.getErrorMessage());
                }
            } else if (task instanceof ValidateResourceTask) {
                // one per cascade step, too chatty for INFO
                LOG.finer(task::getTaskDescription);
            } else {
                LOG.info(task.getTaskDescription());
            }
        }
    }

    /**
     * Moves the validation reports produced so far into {@code out}.
     *
     * @return number of reports moved; 0 also when a task held the lock during this call
     */
    public int dequeuePendingUpdates(@NotNull Collection<? super ValidationReport> out) {
        checkOwnerThread();
        Objects.requireNonNull(out, "out");
        try (CacheState.Locked locked = state.tryLock()) {
            if (locked == null) {
                return 0;
            }
            return locked.drainReports(out);
        }
    }

    /**
     * @return true while submitted tasks are unfinished or child tasks wait to be forwarded.
     */
    public boolean hasPendingWork() {
        return !pendingWork.isEmpty() || state.hasQueuedSubmissions();
    }

    @NotNull
    public CacheLifecycle getLifecycle() {
        return lifecycle;
    }

    /**
     * Memoized verdict of a resource, {@link ResourceValidity#UNKNOWN} for unknown ids.
     * Blocks on the state lock, so it must not be called while a task may be holding it;
     * meant for diagnostics once the cache is idle, never for per-frame use.
     */
    @NotNull
    public ResourceValidity getResourceValidity(@NotNull String id) {
        try (CacheState.Locked locked = state.lock()) {
            Resource resource = locked.resources().get(id);
            return resource == null ? ResourceValidity.UNKNOWN : ResourceValidity.of(resource);
        }
    }

    /**
     * Live resource store without synchronization. Only valid while no work is pending.
     */
    @TestOnly
    @NotNull
    public ResourceStore unsafeResources() {
        return state.unsafeResources();
    }

    /**
     * Live dependency graph without synchronization. Only valid while no work is pending.
     */
    @TestOnly
    @NotNull
    public DependencyGraph unsafeGraph() {
        return state.unsafeGraph();
    }

    /**
     * Destroying the cache with work outstanding is a programming error.
     *
     * @throws IllegalStateException if {@link #hasPendingWork()} is true or when called off the owner thread
     */
    @Override
    public void dispose() {
        checkOwnerThread();
        if (hasPendingWork()) {
            throw new IllegalStateException("Resource cache disposed with pending work. [handles="
                    + pendingWork.size() + "]");
        }
        LOG.fine("Resource cache disposed.");
    }

    private void submit(WorkerTask task) {
        pendingWork.addLast(executor.submit(task));
    }

    private void checkOwnerThread() {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Resource cache used from " + Thread.currentThread().getName()
                    + "; owner is " + owner.getName());
        }
    }

    private static long readLongConfig(Workspace workspace, String key, long defaultValue) {
        String raw = workspace.getConfiguration().getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring malformed configuration value. [key=" + key + ", value='" + raw + "']");
            return defaultValue;
        }
    }
}
