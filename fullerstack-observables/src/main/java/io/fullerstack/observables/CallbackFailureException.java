package io.fullerstack.observables;

/**
 * Thrown to the caller of {@code emit}/{@code set} when a registered callback fails
 * during a notification pass.
 *
 * <p>The callback's exception is the {@linkplain #getCause() cause}. When the owning
 * registry isolates failures, failures from later callbacks in the same pass are
 * attached as {@linkplain #getSuppressed() suppressed} exceptions.
 *
 * @see io.fullerstack.observables.registry.FailurePolicy
 */
public class CallbackFailureException extends RuntimeException {

    private final long hookId;

    /**
     * Creates an exception for the hook that failed first.
     *
     * @param hookId id of the failing hook within its registry
     * @param cause  the exception thrown by the callback
     */
    public CallbackFailureException(long hookId, Throwable cause) {
        super("Hook #" + hookId + " failed during notification: " + cause, cause);
        this.hookId = hookId;
    }

    /**
     * Returns the id of the hook whose callback failed first.
     *
     * @return hook id
     */
    public long hookId() {
        return hookId;
    }
}
