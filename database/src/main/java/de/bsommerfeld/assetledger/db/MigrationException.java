package de.bsommerfeld.assetledger.db;

/**
 * A schema migration failed and was rolled back. The store is still at the
 * previous version; startup must not continue against it.
 */
public class MigrationException extends PersistenceException {

    private final int version;

    public MigrationException(int version, String message, Throwable cause) {
        super(message, cause);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
