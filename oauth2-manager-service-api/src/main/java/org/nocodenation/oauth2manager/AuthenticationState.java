package org.nocodenation.oauth2manager;

/**
 * Authentication state of one service.
 * <p>
 * A revoked service returns to {@link #UNAUTHENTICATED}.
 */
public enum AuthenticationState {

    /** No token on record and no authorization in flight. */
    UNAUTHENTICATED,

    /** An authorization URL was issued and the callback has not been exchanged yet. */
    AUTHORIZATION_PENDING,

    /** A token is on record and has not expired. */
    AUTHENTICATED_VALID,

    /** A token is on record but its expiry has passed. */
    AUTHENTICATED_EXPIRED
}
