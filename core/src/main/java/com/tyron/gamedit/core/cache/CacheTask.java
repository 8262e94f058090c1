package com.tyron.gamedit.core.cache;

import com.tyron.gamedit.api.concurrent.WorkerTask;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Base class of the tasks the resource cache runs on its executor.
 */
abstract class CacheTask extends WorkerTask {

    protected final CacheState state;

    protected CacheTask(@NotNull CacheState state, @NotNull String taskName, @NotNull String taskDescription) {
        super(taskName, taskDescription);
        this.state = Objects.requireNonNull(state, "state");
    }
}
