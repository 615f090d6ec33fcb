package io.fullerstack.observables.hook;

/**
 * The side of a registry that a {@link Hook} talks back to.
 */
public interface HookOwner {

    /**
     * Removes the registration with the given id.
     *
     * @param id hook id
     * @return true if a registration was removed, false if it was already gone
     */
    boolean unregister(long id);

    /**
     * Checks whether the registration with the given id is still present.
     *
     * @param id hook id
     * @return true if registered
     */
    boolean isRegistered(long id);
}
