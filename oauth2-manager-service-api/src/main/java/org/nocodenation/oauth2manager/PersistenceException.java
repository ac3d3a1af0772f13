package org.nocodenation.oauth2manager;

/**
 * Describes a failure to read or write the persisted token file.
 * <p>
 * Persistence is best-effort: this exception is logged and handed to observers, but never
 * thrown to the caller whose operation triggered the write.
 */
public class PersistenceException extends OAuth2Exception {

    private static final long serialVersionUID = 1L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
