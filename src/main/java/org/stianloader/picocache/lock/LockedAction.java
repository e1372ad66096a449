package org.stianloader.picocache.lock;

import java.io.IOException;

/**
 * An action that is run while the lock of a cache key is held.
 *
 * @param <T> The type of the action's result
 */
@FunctionalInterface
public interface LockedAction<T> {
    T run() throws IOException;
}
