package io.fullerstack.observables.registry;

import java.util.function.Consumer;

/**
 * One stored callback. {@code active} is cleared on removal so that passes holding an
 * older snapshot skip it.
 */
final class Registration<T> {

    final long id;
    final Consumer<? super T> callback;
    volatile boolean active = true;

    Registration(long id, Consumer<? super T> callback) {
        this.id = id;
        this.callback = callback;
    }
}
