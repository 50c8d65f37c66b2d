package de.bsommerfeld.assetledger.db;

/**
 * A unique, foreign-key, not-null or check constraint rejected a write.
 */
public class ConstraintViolationException extends PersistenceException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
