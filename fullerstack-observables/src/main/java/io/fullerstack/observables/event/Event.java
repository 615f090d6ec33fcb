package io.fullerstack.observables.event;

import io.fullerstack.observables.hook.Hook;
import io.fullerstack.observables.registry.FailurePolicy;
import io.fullerstack.observables.registry.SubscriberRegistry;

import java.util.function.Consumer;

/**
 * Synchronous, fire-and-forget notification.
 *
 * <p>{@link #emit(Object)} invokes every hooked callback in registration order before it
 * returns. Nothing is queued and no payload is retained between emissions. Callbacks must
 * not keep a mutable payload beyond their invocation.
 *
 * <pre>
 * Event&lt;String&gt; clicked = new Event&lt;&gt;();
 * Hook hook = clicked.hook(button -&gt; log.add(button));
 * clicked.emit("ok");
 * hook.release();
 * </pre>
 *
 * @param <T> the payload type
 */
public class Event<T> implements AutoCloseable {

    private final SubscriberRegistry<T> registry;

    public Event() {
        this("event", FailurePolicy.FAIL_FAST);
    }

    /**
     * Creates an event.
     *
     * @param name          name used in log messages
     * @param failurePolicy what {@link #emit(Object)} does when a callback throws
     */
    public Event(String name, FailurePolicy failurePolicy) {
        this.registry = new SubscriberRegistry<>(name, failurePolicy);
    }

    public static <T> Event<T> create() {
        return new Event<>();
    }

    /**
     * Registers a callback for future emissions.
     *
     * @param callback the callback
     * @return hook that unregisters the callback when released
     * @throws NullPointerException  if callback is null
     * @throws IllegalStateException if this event is closed
     */
    public Hook hook(Consumer<? super T> callback) {
        return registry.register(callback);
    }

    /**
     * Delivers the payload to every hooked callback.
     *
     * @param payload the payload; may be null
     * @throws io.fullerstack.observables.CallbackFailureException if a callback throws
     */
    public void emit(T payload) {
        registry.notifyAll(payload);
    }

    public int hookCount() {
        return registry.size();
    }

    public String name() {
        return registry.name();
    }

    public boolean isClosed() {
        return registry.isClosed();
    }

    /**
     * Drops all hooks. Later emissions reach nobody and later hooks are rejected.
     */
    @Override
    public void close() {
        registry.close();
    }

    @Override
    public String toString() {
        return "Event[name=" + registry.name() + ", hooks=" + registry.size() + "]";
    }
}
