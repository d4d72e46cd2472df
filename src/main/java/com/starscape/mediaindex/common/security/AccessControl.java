package com.starscape.mediaindex.common.security;

import com.starscape.mediaindex.common.exception.UnauthorizedException;

/**
 * Permission check consulted before any batch operation touches the store.
 */
public interface AccessControl {
    
    boolean isAllowed(UserPrincipal caller, Resource resource, Action action);
    
    /**
     * Throws {@link UnauthorizedException} unless the caller may perform the action.
     */
    default void check(UserPrincipal caller, Resource resource, Action action) {
        if (!isAllowed(caller, resource, action)) {
            throw new UnauthorizedException(
                String.format("Not allowed to %s %s", action.name().toLowerCase(), resource.name().toLowerCase()));
        }
    }
}
