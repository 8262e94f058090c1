package com.tyron.gamedit.core.cache;

/**
 * Whether the dependency graph has been built at least once.
 * <p>
 * Until the first {@link ResourceCache#buildCache()} adds and deletes only touch the store;
 * afterwards every change also rebuilds the graph and re-validates.
 */
public enum CacheLifecycle {
    UNINITIALIZED,
    INITIALIZED
}
