package com.tyron.gamedit.api.resource;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Memoized validity of a resource.
 * <p>
 * Stored in the resource property bag under {@link #PROPERTY_KEY}: absent means {@link #UNKNOWN},
 * {@code true} means {@link #VALID} and {@code false} means {@link #INVALID}.
 */
public enum ResourceValidity {
    UNKNOWN,
    VALID,
    INVALID;

    public static final String PROPERTY_KEY = "is-valid";

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    @NotNull
    public static ResourceValidity of(@NotNull Resource resource) {
        Objects.requireNonNull(resource, "resource");
        Object value = resource.getProperty(PROPERTY_KEY);
        if (value instanceof Boolean b) {
            return b ? VALID : INVALID;
        }
        return UNKNOWN;
    }

    @NotNull
    public static ResourceValidity of(boolean valid) {
        return valid ? VALID : INVALID;
    }

    public static void store(@NotNull Resource resource, @NotNull ResourceValidity validity) {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(validity, "validity");
        switch (validity) {
            case UNKNOWN -> resource.deleteProperty(PROPERTY_KEY);
            case VALID -> resource.setProperty(PROPERTY_KEY, Boolean.TRUE);
            case INVALID -> resource.setProperty(PROPERTY_KEY, Boolean.FALSE);
        }
    }

    public static void clear(@NotNull Resource resource) {
        store(resource, UNKNOWN);
    }
}
