package com.tyron.gamedit.api.concurrent;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A unit of background work handed to a {@link TaskExecutor}.
 * <p>
 * Subclasses implement {@link #doTask()}. Executors call {@link #execute()} exactly once; any
 * exception escaping {@link #doTask()} is recorded on the task instead of killing the worker.
 */
public abstract class WorkerTask {

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean complete;

    private final String taskName;
    private final String taskDescription;

    private volatile String errorMessage;
    private volatile Throwable error;

    protected WorkerTask(@NotNull String taskName, @NotNull String taskDescription) {
        this.taskName = Objects.requireNonNull(taskName, "taskName");
        this.taskDescription = Objects.requireNonNull(taskDescription, "taskDescription");
    }

    /**
     * The actual work. Runs on an executor thread.
     */
    protected abstract void doTask() throws Exception;

    public final void execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Task already executed: " + taskName);
        }
        try {
            doTask();
        } catch (Throwable t) {
            error = t;
            if (errorMessage == null) {
                errorMessage = t.getMessage() != null ? t.getMessage() : t.getClass().getName();
            }
        } finally {
            complete = true;
        }
    }

    public boolean isComplete() {
        return complete;
    }

    @NotNull
    public String getTaskName() {
        return taskName;
    }

    @NotNull
    public String getTaskDescription() {
        return taskDescription;
    }

    /**
     * Marks the task as failed with a message. The task still completes normally.
     */
    protected void setError(@NotNull String message) {
        this.errorMessage = Objects.requireNonNull(message, "message");
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return the exception thrown by {@link #doTask()}, if any.
     */
    @Nullable
    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return taskName + " (" + taskDescription + ")";
    }
}
