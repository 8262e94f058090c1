package com.tyron.gamedit.api.workspace;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Success/failure of a persistence operation. Failures are values, not exceptions.
 */
public final class StorageResult {

    private static final StorageResult OK = new StorageResult(true, null);

    private final boolean success;
    private final String message;

    private StorageResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public static StorageResult ok() {
        return OK;
    }

    public static StorageResult failure(@NotNull String message) {
        return new StorageResult(false, Objects.requireNonNull(message, "message"));
    }

    public boolean isSuccess() {
        return success;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return success ? "StorageResult[ok]" : "StorageResult[failure: " + message + "]";
    }
}
