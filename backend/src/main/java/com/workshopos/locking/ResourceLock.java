package com.workshopos.locking;

import java.util.function.Supplier;

/**
 * Named mutual exclusion. At most one action per key runs at a time; callers
 * block until the key is free. There is no acquisition timeout.
 */
public interface ResourceLock {

    <T> T withLock(String key, Supplier<T> action);

    default void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /** Lock key shared by every capacity-affecting mutation within a portal. */
    static String portalKey(String portalName) {
        return "portal:" + portalName;
    }
}
