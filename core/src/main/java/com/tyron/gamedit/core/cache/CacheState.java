package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.concurrent.WorkerTask;
import com.tyron.gamedit.api.project.ProjectSettings;
import com.tyron.gamedit.api.resource.ValidationReport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state shared between the cache owner thread and the cache tasks.
 * <p>
 * All fields are only reachable through a {@link Locked} handle, which exists exactly while
 * the state lock is held:
 * <pre>
 * try (CacheState.Locked locked = state.lock()) {
 *     locked.resources().insert(id, resource);
 * }
 * </pre>
 * The lock must never be held while calling into the task executor.
 */
public final class CacheState {

    private final ReentrantLock lock = new ReentrantLock();

    private final ResourceStore resources = new ResourceStore();
    private DependencyGraph graph = DependencyGraph.empty();
    private ProjectSettings settings = new ProjectSettings();

    // child tasks waiting for the owner thread to forward them to the executor
    private final List<WorkerTask> submitQueue = new ArrayList<>();
    private final List<ValidationReport> updateQueue = new ArrayList<>();

    // mirrors submitQueue.size() so the owner can poll without taking the lock
    private final AtomicInteger queuedSubmissions = new AtomicInteger();

    /**
     * Blocks until the lock is available.
     */
    @NotNull
    public Locked lock() {
        lock.lock();
        return new Locked();
    }

    /**
     * @return a handle if the lock was free, otherwise null. Never blocks.
     */
    @Nullable
    public Locked tryLock() {
        if (!lock.tryLock()) {
            return null;
        }
        return new Locked();
    }

    public boolean hasQueuedSubmissions() {
        return queuedSubmissions.get() > 0;
    }

    /**
     * Unsynchronized access for diagnostics and tests. Only safe when no task is in flight.
     */
    @NotNull
    ResourceStore unsafeResources() {
        return resources;
    }

    /**
     * Unsynchronized access for diagnostics and tests. Only safe when no task is in flight.
     */
    @NotNull
    DependencyGraph unsafeGraph() {
        return graph;
    }

    /**
     * Proof of holding the state lock. Closing it releases the lock; any use afterwards fails.
     */
    public final class Locked implements AutoCloseable {

        private final Thread holder = Thread.currentThread();
        private boolean closed;

        private Locked() {
        }

        @NotNull
        public ResourceStore resources() {
            checkHeld();
            return resources;
        }

        @NotNull
        public DependencyGraph graph() {
            checkHeld();
            return graph;
        }

        public void setGraph(@NotNull DependencyGraph newGraph) {
            checkHeld();
            graph = Objects.requireNonNull(newGraph, "newGraph");
        }

        @NotNull
        public ProjectSettings settings() {
            checkHeld();
            return settings;
        }

        public void setSettings(@NotNull ProjectSettings newSettings) {
            checkHeld();
            settings = Objects.requireNonNull(newSettings, "newSettings");
        }

        /**
         * Queues a child task. The owner thread forwards it on its next tick.
         */
        public void enqueueSubmission(@NotNull WorkerTask task) {
            checkHeld();
            submitQueue.add(Objects.requireNonNull(task, "task"));
            queuedSubmissions.incrementAndGet();
        }

        /**
         * Removes up to {@code max} queued child tasks, oldest first.
         */
        @NotNull
        public List<WorkerTask> takeSubmissions(int max) {
            checkHeld();
            if (submitQueue.isEmpty() || max <= 0) {
                return List.of();
            }
            int count = Math.min(max, submitQueue.size());
            List<WorkerTask> head = submitQueue.subList(0, count);
            List<WorkerTask> taken = new ArrayList<>(head);
            head.clear();
            queuedSubmissions.addAndGet(-count);
            return taken;
        }

        public void enqueueReport(@NotNull ValidationReport report) {
            checkHeld();
            updateQueue.add(Objects.requireNonNull(report, "report"));
        }

        /**
         * Moves every queued report into {@code out}.
         *
         * @return number of reports moved
         */
        public int drainReports(@NotNull Collection<? super ValidationReport> out) {
            checkHeld();
            int count = updateQueue.size();
            out.addAll(updateQueue);
            updateQueue.clear();
            return count;
        }

        private void checkHeld() {
            if (closed) {
                throw new IllegalStateException("Cache state accessed after the lock was released");
            }
            if (Thread.currentThread() != holder) {
                throw new IllegalStateException("Cache state handle used from " + Thread.currentThread().getName()
                        + " but the lock is held by " + holder.getName());
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            lock.unlock();
        }
    }
}
