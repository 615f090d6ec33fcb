package io.fullerstack.observables.registry;

import io.fullerstack.observables.CallbackFailureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The registrations present at the moment a pass was captured, in registration order.
 *
 * <p>Callbacks added after capture are not part of the pass. Callbacks removed after
 * capture but before their turn are skipped.
 *
 * @param <T> the notified value type
 * @see SubscriberRegistry#capture()
 */
public final class NotificationPass<T> {

    private static final Logger logger = LoggerFactory.getLogger(NotificationPass.class);

    /** Passed as the excluded id when no registration is excluded. Ids start at 1. */
    public static final long NO_EXCLUSION = 0L;

    private final String registryName;
    private final List<Registration<T>> registrations;
    private final FailurePolicy failurePolicy;

    NotificationPass(String registryName, List<Registration<T>> registrations, FailurePolicy failurePolicy) {
        this.registryName = registryName;
        this.registrations = registrations;
        this.failurePolicy = failurePolicy;
    }

    /**
     * Invokes every captured callback that is still registered.
     *
     * @param value the value handed to each callback
     * @throws CallbackFailureException if a callback throws
     */
    public void dispatch(T value) {
        dispatchExcept(value, NO_EXCLUSION);
    }

    /**
     * Invokes every captured callback that is still registered, except one.
     *
     * @param value      the value handed to each callback
     * @param excludedId id of the registration to skip, or {@link #NO_EXCLUSION}
     * @throws CallbackFailureException if a callback throws
     */
    public void dispatchExcept(T value, long excludedId) {
        CallbackFailureException failure = null;

        for (Registration<T> registration : registrations) {
            if (!registration.active || registration.id == excludedId) {
                continue;
            }
            try {
                registration.callback.accept(value);
            } catch (RuntimeException e) {
                if (failurePolicy == FailurePolicy.FAIL_FAST) {
                    throw new CallbackFailureException(registration.id, e);
                }
                logger.warn("Hook #{} of '{}' failed; continuing pass", registration.id, registryName, e);
                if (failure == null) {
                    failure = new CallbackFailureException(registration.id, e);
                } else {
                    failure.addSuppressed(e);
                }
            } catch (Error e) {
                if (failure != null) {
                    e.addSuppressed(failure);
                }
                throw e;
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Returns the number of registrations captured, including any removed since.
     *
     * @return captured size
     */
    public int size() {
        return registrations.size();
    }
}
