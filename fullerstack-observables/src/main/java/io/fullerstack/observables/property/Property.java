package io.fullerstack.observables.property;

import io.fullerstack.observables.hook.Hook;
import io.fullerstack.observables.registry.NotificationPass;
import io.fullerstack.observables.registry.SubscriberRegistry;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Observable mutable value.
 *
 * <p>Every write stores the value and then, before returning, invokes each hooked callback
 * in registration order with the written value. Hooking does not replay the current value;
 * callbacks only see future writes.
 *
 * <p>By default every write notifies, even when the value is unchanged. Create the property
 * with {@link PropertyOptions#isDistinct() distinct} to skip writes equal to the current
 * value.
 *
 * <p><b>Thread safety:</b> the value is stored under the registry lock in the same critical
 * section that snapshots the subscribers; callbacks run after the lock is released. Readers
 * never see a partially written value and every notification carries a value some write
 * stored. Notification passes of concurrent writers may interleave.
 *
 * @param <T> the value type
 */
public class Property<T> implements AutoCloseable {

    private final SubscriberRegistry<T> registry;
    private final boolean distinct;

    private volatile T value;

    public Property(T initial) {
        this(initial, PropertyOptions.defaults());
    }

    public Property(T initial, PropertyOptions options) {
        Objects.requireNonNull(options, "Options cannot be null");
        this.registry = new SubscriberRegistry<>(options.getName(), options.getFailurePolicy());
        this.distinct = options.isDistinct();
        this.value = initial;
    }

    public static <T> Property<T> of(T initial) {
        return new Property<>(initial);
    }

    /**
     * Returns the current value. No side effects.
     *
     * @return the value
     */
    public T get() {
        return value;
    }

    /**
     * Stores a value and notifies every subscriber with it.
     *
     * @param newValue the value; may be null
     * @throws io.fullerstack.observables.CallbackFailureException if a callback throws
     */
    public void set(T newValue) {
        write(newValue, NotificationPass.NO_EXCLUSION);
    }

    /**
     * Atomically replaces the value with the result of the function, then notifies.
     * The function runs under the property's lock and should be short.
     *
     * @param function maps the current value to the new one
     * @return the new value
     */
    public T update(UnaryOperator<T> function) {
        return update(function, NotificationPass.NO_EXCLUSION);
    }

    /**
     * Registers a change listener. The listener is not invoked with the current value.
     *
     * @param callback the listener
     * @return hook that unregisters the listener when released
     * @throws IllegalStateException if this property is closed
     */
    public Hook hook(Consumer<? super T> callback) {
        return registry.register(callback);
    }

    /**
     * Registers a change listener and returns a binding that can also read the value.
     *
     * @param callback the listener
     * @return the binding
     */
    public Binding<T> bind(Consumer<? super T> callback) {
        return new Binding<>(this, registry.register(callback));
    }

    /**
     * Registers a change listener and returns a binding that can read and write the value.
     * Writes made through the binding notify every subscriber except the binding itself.
     *
     * @param callback the listener
     * @return the binding
     */
    public MutableBinding<T> bindMutable(Consumer<? super T> callback) {
        return new MutableBinding<>(this, registry.register(callback));
    }

    public int hookCount() {
        return registry.size();
    }

    public String name() {
        return registry.name();
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isClosed() {
        return registry.isClosed();
    }

    /**
     * Drops all hooks. The value remains readable and writable, but writes notify nobody.
     */
    @Override
    public void close() {
        registry.close();
    }

    void write(T newValue, long excludedId) {
        NotificationPass<T> pass = registry.withLock(() -> store(newValue) ? registry.capture() : null);
        if (pass != null) {
            pass.dispatchExcept(newValue, excludedId);
        }
    }

    T update(UnaryOperator<T> function, long excludedId) {
        Objects.requireNonNull(function, "Update function cannot be null");
        Write<T> write = registry.withLock(() -> {
            T next = function.apply(value);
            return new Write<>(next, store(next) ? registry.capture() : null);
        });
        if (write.pass() != null) {
            write.pass().dispatchExcept(write.value(), excludedId);
        }
        return write.value();
    }

    // Caller holds the registry lock
    private boolean store(T newValue) {
        if (distinct && Objects.equals(value, newValue)) {
            return false;
        }
        value = newValue;
        return true;
    }

    private record Write<T>(T value, NotificationPass<T> pass) {
    }

    @Override
    public String toString() {
        return "Property[name=" + registry.name() + ", value=" + value + ", hooks=" + registry.size() + "]";
    }
}
