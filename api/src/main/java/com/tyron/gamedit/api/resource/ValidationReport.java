package com.tyron.gamedit.api.resource;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of one completed validation, delivered to observers such as the event log.
 *
 * @param resourceId   id of the validated resource
 * @param resourceName name of the resource, or null if the id no longer resolves
 * @param valid        whether the resource and everything it refers to exists and is valid
 */
public record ValidationReport(@NotNull String resourceId, @Nullable String resourceName, boolean valid) {

    public ValidationReport {
        Objects.requireNonNull(resourceId, "resourceId");
    }
}
