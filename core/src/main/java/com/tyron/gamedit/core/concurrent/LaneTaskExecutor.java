package com.tyron.gamedit.core.concurrent;

import com.tyron.gamedit.api.concurrent.TaskExecutor;
import com.tyron.gamedit.api.concurrent.TaskHandle;
import com.tyron.gamedit.api.concurrent.WorkerTask;
import com.tyron.gamedit.api.service.Disposable;
import com.tyron.gamedit.api.workspace.Workspace;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs tasks on a single named worker lane.
 * <p>
 * One thread per lane means tasks execute strictly in submission order, which is what the
 * resource cache requires from its executor.
 */
public final class LaneTaskExecutor implements TaskExecutor, Disposable {

    private static final Logger LOG = Logger.getLogger(LaneTaskExecutor.class.getName());

    /**
     * Name of the worker lane. Defaults to {@link #DEFAULT_LANE}.
     */
    public static final String LANE_KEY = "gamedit.cache.lane";

    public static final String DEFAULT_LANE = "resource-cache";

    private final String lane;
    private final ExecutorService exec;
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicLong submitted = new AtomicLong();

    public LaneTaskExecutor(@NotNull String lane) {
        this.lane = Objects.requireNonNull(lane, "lane");
        this.exec = Executors.newSingleThreadExecutor(createThreadFactory(lane));
    }

    public static LaneTaskExecutor forWorkspace(@NotNull Workspace workspace) {
        String lane = workspace.getConfiguration().getProperty(LANE_KEY, DEFAULT_LANE);
        if (lane == null || lane.isBlank()) {
            lane = DEFAULT_LANE;
        }
        return new LaneTaskExecutor(lane.trim());
    }

    @Override
    public @NotNull TaskHandle submit(@NotNull WorkerTask task) {
        Objects.requireNonNull(task, "task");
        if (disposed.get()) {
            throw new IllegalStateException("Lane '" + lane + "' is disposed, cannot run " + task.getTaskName());
        }
        try {
            exec.execute(task::execute);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Lane '" + lane + "' rejected " + task.getTaskName(), e);
        }
        submitted.incrementAndGet();
        return TaskHandle.of(task);
    }

    public String getLane() {
        return lane;
    }

    public long getSubmittedCount() {
        return submitted.get();
    }

    /**
     * Stops accepting tasks and lets the already queued ones finish.
     */
    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        exec.shutdown();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warning("Lane '" + lane + "' did not finish queued tasks in time, interrupting.");
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }

    private static ThreadFactory createThreadFactory(String lane) {
        return r -> {
            Thread t = new Thread(r, "CacheLane-" + lane);
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thread, e) ->
                    LOG.log(Level.SEVERE, "Uncaught exception on " + thread.getName(), e));
            return t;
        };
    }
}
