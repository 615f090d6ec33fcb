package io.fullerstack.observables.registry;

import io.fullerstack.observables.hook.Hook;
import io.fullerstack.observables.hook.HookOwner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Ordered collection of callbacks with handle-based removal.
 *
 * <p><b>Ordering:</b> callbacks are invoked in registration order. Ids come from a
 * per-registry counter starting at 1 and are never reused.
 *
 * <p><b>Snapshot semantics:</b> a notification pass works on the registrations present
 * when it starts. A callback registered during a pass is first invoked by the next pass.
 * A callback removed during a pass is not invoked if its turn has not come yet. Callbacks
 * may release their own hook or any other hook mid-pass.
 *
 * <p><b>Locking:</b> a single {@link ReentrantLock} guards the registrations. It is held
 * only to mutate or snapshot them, never while callbacks run, so callbacks may call back
 * into the same registry from the notifying thread. Owners that keep state alongside the
 * registry (a Property's value) mutate it under {@link #withLock(Supplier)} and snapshot
 * with {@link #capture()} in the same critical section.
 *
 * <p><b>Failures:</b> see {@link FailurePolicy}.
 *
 * @param <T> the notified value type
 */
public class SubscriberRegistry<T> implements HookOwner, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final String name;
    private final FailurePolicy failurePolicy;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private final Map<Long, Registration<T>> registrations = new LinkedHashMap<>();
    private long nextId = 1;

    private volatile boolean closed = false;

    /**
     * Creates a fail-fast registry.
     *
     * @param name name used in log messages
     */
    public SubscriberRegistry(String name) {
        this(name, FailurePolicy.FAIL_FAST);
    }

    /**
     * Creates a registry.
     *
     * @param name          name used in log messages
     * @param failurePolicy what a pass does when a callback throws
     * @throws NullPointerException if name or failurePolicy is null
     */
    public SubscriberRegistry(String name, FailurePolicy failurePolicy) {
        this.name = Objects.requireNonNull(name, "Registry name cannot be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "Failure policy cannot be null");
    }

    public String name() {
        return name;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    /**
     * Stores a callback at the end of the invocation order.
     *
     * @param callback the callback, owned by this registry from now on
     * @return the hook controlling the registration
     * @throws NullPointerException  if callback is null
     * @throws IllegalStateException if the registry is closed
     */
    public Hook register(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "Callback cannot be null");
        long id;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Cannot hook into closed '" + name + "'");
            }
            id = nextId++;
            registrations.put(id, new Registration<>(id, callback));
        } finally {
            lock.unlock();
        }
        logger.trace("Registered hook #{} on '{}'", id, name);
        return Hook.attach(this, id);
    }

    /**
     * Removes a registration. Unknown, already removed and post-close ids are ignored.
     *
     * @param id hook id
     * @return true if a registration was removed
     */
    @Override
    public boolean unregister(long id) {
        Registration<T> removed;
        lock.lock();
        try {
            removed = registrations.remove(id);
            if (removed != null) {
                removed.active = false;
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            logger.trace("Hook #{} not registered on '{}'; ignoring", id, name);
            return false;
        }
        logger.trace("Unregistered hook #{} from '{}'", id, name);
        return true;
    }

    @Override
    public boolean isRegistered(long id) {
        lock.lock();
        try {
            return registrations.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Invokes every registered callback, in registration order, with the value.
     *
     * @param value the value to deliver; may be null
     * @throws io.fullerstack.observables.CallbackFailureException if a callback throws
     */
    public void notifyAll(T value) {
        capture().dispatch(value);
    }

    /**
     * Like {@link #notifyAll(Object)} but skips one registration.
     *
     * @param value      the value to deliver
     * @param excludedId id to skip
     */
    public void notifyAllExcept(T value, long excludedId) {
        capture().dispatchExcept(value, excludedId);
    }

    /**
     * Snapshots the current registrations into a pass that can be dispatched once the
     * lock is released.
     *
     * @return the pass
     */
    public NotificationPass<T> capture() {
        lock.lock();
        try {
            return new NotificationPass<>(name, new ArrayList<>(registrations.values()), failurePolicy);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs an action while holding the registry lock. The lock is reentrant, so the
     * action may call {@link #capture()}.
     *
     * @param action the action
     * @param <R>    result type
     * @return the action's result
     */
    public <R> R withLock(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return registrations.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Drops every registration. Outstanding hooks become inert and further
     * {@link #register(Consumer)} calls fail. Idempotent.
     */
    @Override
    public void close() {
        int dropped;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            dropped = registrations.size();
            registrations.values().forEach(registration -> registration.active = false);
            registrations.clear();
        } finally {
            lock.unlock();
        }
        logger.debug("Closed '{}', dropped {} hooks", name, dropped);
    }

    @Override
    public String toString() {
        return "SubscriberRegistry[name=" + name + ", size=" + size() + ", closed=" + closed + "]";
    }
}
