package de.bsommerfeld.assetledger.db;

/**
 * Brings a freshly created store file up to the current schema. Invoked by
 * {@link ConnectionManager#open()} on the opening thread, with that thread's
 * connection already bound.
 */
@FunctionalInterface
public interface SchemaInitializer {

    SchemaInitializer NONE = manager -> {
    };

    void initialize(ConnectionManager manager);
}
