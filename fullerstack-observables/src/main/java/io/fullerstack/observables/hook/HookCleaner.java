package io.fullerstack.observables.hook;

import lombok.experimental.UtilityClass;

import java.lang.ref.Cleaner;

/**
 * Shared {@link Cleaner} that unregisters hooks which become unreachable without
 * having been released.
 *
 * <p>This is a safety net only. Hooks should be released explicitly, or scoped with
 * try-with-resources.
 */
@UtilityClass
class HookCleaner {

    private final Cleaner CLEANER = Cleaner.create();

    Cleaner.Cleanable register(Hook hook, Runnable action) {
        return CLEANER.register(hook, action);
    }
}
