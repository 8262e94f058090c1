package com.tyron.gamedit.api.concurrent;

import org.jetbrains.annotations.NotNull;

/**
 * Non-blocking reference to a task that was submitted to a {@link TaskExecutor}.
 * There is no cancellation: once submitted, a task runs to completion.
 */
public interface TaskHandle {

    /**
     * Safe to poll from any thread at any time; never blocks.
     */
    boolean isComplete();

    /**
     * @return the submitted task, for inspecting its name and error state after completion.
     */
    @NotNull
    WorkerTask getTask();

    static TaskHandle of(WorkerTask task) {
        return new TaskHandle() {
            @Override
            public boolean isComplete() {
                return task.isComplete();
            }

            @Override
            public @NotNull WorkerTask getTask() {
                return task;
            }

            @Override
            public String toString() {
                return "TaskHandle[" + task.getTaskName() + ", complete=" + task.isComplete() + "]";
            }
        };
    }
}
