package io.fullerstack.observables.property;

import io.fullerstack.observables.hook.Hook;

import java.util.function.UnaryOperator;

/**
 * A binding that can write the property. A write made through this binding is delivered
 * to every other subscriber but not echoed back to this binding's own listener, which
 * lets two sides of a two-way binding update each other without looping.
 *
 * @param <T> the value type
 * @see Property#bindMutable(java.util.function.Consumer)
 */
public class MutableBinding<T> extends Binding<T> {

    MutableBinding(Property<T> property, Hook hook) {
        super(property, hook);
    }

    /**
     * Writes the property, notifying everyone except this binding.
     *
     * @param newValue the value
     * @throws IllegalStateException if the binding was released
     */
    public void set(T newValue) {
        ensureActive();
        property.write(newValue, hook.id());
    }

    /**
     * Atomically updates the property, notifying everyone except this binding.
     *
     * @param function maps the current value to the new one
     * @return the new value
     * @throws IllegalStateException if the binding was released
     */
    public T update(UnaryOperator<T> function) {
        ensureActive();
        return property.update(function, hook.id());
    }
}
