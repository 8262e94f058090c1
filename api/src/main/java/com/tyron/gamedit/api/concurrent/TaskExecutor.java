package com.tyron.gamedit.api.concurrent;

import org.jetbrains.annotations.NotNull;

/**
 * Executor the resource cache hands its tasks to.
 *
 * Threading contract:
 * - {@link #submit(WorkerTask)} is only called from the thread that owns the cache.
 * - Tasks must be executed in submission order. The cache relies on this, e.g. a dependency
 *   graph rebuild has to finish before the validation submitted after it starts reading it.
 */
@FunctionalInterface
public interface TaskExecutor {

    @NotNull
    TaskHandle submit(@NotNull WorkerTask task);
}
