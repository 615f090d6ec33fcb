package io.fullerstack.observables.hook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one callback registration in one registry.
 *
 * <p>Releasing the hook (via {@link #release()} or {@link #close()}) removes the callback;
 * it is never invoked again afterwards. Release is idempotent and never fails, including
 * when the owning Event or Property has already been closed or collected.
 *
 * <p>A hook holds its registry weakly, so an outstanding hook does not keep an Event or
 * Property alive. A hook that becomes unreachable without being released is unregistered
 * by a {@link Cleaner}; this timing is nondeterministic, so release hooks explicitly:
 * <pre>
 * try (Hook hook = event.hook(value -&gt; log.add(value))) {
 *     event.emit("a");
 * }
 * </pre>
 *
 * <p>A hook should have a single owner. Sharing it is safe but any holder can release it.
 */
public final class Hook implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Hook.class);

    private final long id;
    private final WeakReference<HookOwner> owner;
    private final Unregistration unregistration;
    private final Cleaner.Cleanable cleanable;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Hook(HookOwner owner, long id) {
        this.id = id;
        this.owner = new WeakReference<>(owner);
        this.unregistration = new Unregistration(this.owner, id);
        this.cleanable = HookCleaner.register(this, unregistration);
    }

    /**
     * Creates a hook for a registration that the owner has just stored.
     *
     * @param owner the registry holding the registration
     * @param id    registration id, unique within the owner
     * @return a live hook
     * @throws NullPointerException if owner is null
     */
    public static Hook attach(HookOwner owner, long id) {
        Objects.requireNonNull(owner, "Hook owner cannot be null");
        return new Hook(owner, id);
    }

    /**
     * Returns this hook's id within its registry.
     *
     * @return the id
     */
    public long id() {
        return id;
    }

    /**
     * Unregisters the callback. Safe to call any number of times.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            unregistration.explicit = true;
            cleanable.clean();
        } else {
            logger.trace("Hook #{} already released", id);
        }
    }

    /**
     * Same as {@link #release()}.
     */
    @Override
    public void close() {
        release();
    }

    /**
     * Gives up this handle without unregistering. The callback stays registered until the
     * owning Event or Property is closed; releasing this hook afterwards does nothing.
     */
    public void detach() {
        if (released.compareAndSet(false, true)) {
            unregistration.armed = false;
            cleanable.clean();
            logger.trace("Hook #{} detached", id);
        }
    }

    /**
     * Checks whether the callback is still registered and this handle still controls it.
     *
     * @return true if release would remove a live registration
     */
    public boolean isActive() {
        if (released.get()) {
            return false;
        }
        HookOwner current = owner.get();
        return current != null && current.isRegistered(id);
    }

    @Override
    public String toString() {
        return "Hook[id=" + id + ", active=" + isActive() + "]";
    }

    /**
     * Cleaning action. Must not reference the {@link Hook} itself or the Cleaner would
     * never see it become unreachable.
     */
    private static final class Unregistration implements Runnable {

        private final WeakReference<HookOwner> owner;
        private final long id;
        private volatile boolean armed = true;
        private volatile boolean explicit = false;

        private Unregistration(WeakReference<HookOwner> owner, long id) {
            this.owner = owner;
            this.id = id;
        }

        @Override
        public void run() {
            if (!armed) {
                return;
            }
            HookOwner current = owner.get();
            if (current == null) {
                logger.trace("Hook #{} outlived its registry", id);
                return;
            }
            boolean removed = current.unregister(id);
            if (removed && !explicit) {
                logger.debug("Hook #{} became unreachable without release; unregistered it", id);
            }
        }
    }
}
