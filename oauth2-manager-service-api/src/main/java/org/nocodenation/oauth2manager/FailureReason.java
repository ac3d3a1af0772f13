package org.nocodenation.oauth2manager;

/**
 * Detail for token endpoint failures.
 * <p>
 * Callers act on the exception type; the reason only tells what went wrong.
 */
public enum FailureReason {

    /** The token endpoint could not be reached: timeout, refused connection, I/O error. */
    TRANSPORT,

    /** The token endpoint answered with a non-success status or a malformed body. */
    PROTOCOL,

    /** A refresh was requested for a service without a token. */
    NO_TOKEN,

    /** A refresh was requested for a token without a refresh token. */
    NO_REFRESH_TOKEN
}
