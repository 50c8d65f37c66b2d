package de.bsommerfeld.assetledger.db;

/**
 * Thrown when a file the caller explicitly named does not exist, e.g. the
 * backup passed to {@link ConnectionManager#restore}. Missing records are
 * reported through return values instead.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
