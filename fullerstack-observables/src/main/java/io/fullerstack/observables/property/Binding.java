package io.fullerstack.observables.property;

import io.fullerstack.observables.hook.Hook;

/**
 * A property listener that can also read the property it listens to.
 *
 * <p>Releasing the binding unregisters the listener; reading through a released binding
 * throws {@link IllegalStateException}.
 *
 * @param <T> the value type
 * @see Property#bind(java.util.function.Consumer)
 */
public class Binding<T> implements AutoCloseable {

    protected final Property<T> property;
    protected final Hook hook;

    Binding(Property<T> property, Hook hook) {
        this.property = property;
        this.hook = hook;
    }

    /**
     * Reads the bound property's current value.
     *
     * @return the value
     * @throws IllegalStateException if the binding was released
     */
    public T get() {
        ensureActive();
        return property.get();
    }

    public Hook hook() {
        return hook;
    }

    public boolean isActive() {
        return hook.isActive();
    }

    public void release() {
        hook.release();
    }

    @Override
    public void close() {
        release();
    }

    protected void ensureActive() {
        if (!hook.isActive()) {
            throw new IllegalStateException("Binding #" + hook.id() + " to '" + property.name() + "' is no longer active");
        }
    }
}
