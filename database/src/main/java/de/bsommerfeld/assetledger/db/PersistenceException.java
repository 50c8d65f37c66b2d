package de.bsommerfeld.assetledger.db;

/**
 * Unchecked wrapper for failures of the record store. The failing statement
 * and its parameters have already been logged when this is thrown.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
