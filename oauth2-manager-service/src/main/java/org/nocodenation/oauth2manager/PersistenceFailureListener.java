package org.nocodenation.oauth2manager;

/**
 * Receives token store persistence failures, which are otherwise only logged.
 */
@FunctionalInterface
public interface PersistenceFailureListener {

    void onPersistenceFailure(PersistenceException exception);
}
