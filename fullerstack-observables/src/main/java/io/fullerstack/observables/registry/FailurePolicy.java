package io.fullerstack.observables.registry;

/**
 * What a notification pass does when a callback throws.
 *
 * <p>In both cases the registry itself is left intact and later passes behave normally.
 */
public enum FailurePolicy {

    /**
     * Abort the pass at the first failure. Callbacks after the failing one are not invoked
     * and the failure is thrown to the caller wrapped in a
     * {@link io.fullerstack.observables.CallbackFailureException}.
     */
    FAIL_FAST,

    /**
     * Invoke every callback in the pass, logging each failure. After the pass the first
     * failure is thrown wrapped in a {@link io.fullerstack.observables.CallbackFailureException},
     * with the later ones attached as suppressed exceptions.
     */
    ISOLATE
}
