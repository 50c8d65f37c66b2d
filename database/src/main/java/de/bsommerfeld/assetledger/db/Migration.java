package de.bsommerfeld.assetledger.db;

import java.util.List;

/**
 * A versioned, one-time schema or data change.
 *
 * @param version    unique, applied in ascending order
 * @param name       human readable label recorded in the ledger
 * @param statements executed in order inside one transaction
 */
public record Migration(int version, String name, List<String> statements) {

    public Migration {
        if (version <= 0)
            throw new IllegalArgumentException("Migration version must be positive: " + version);
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Migration name must not be blank");
        statements = List.copyOf(statements);
    }

    /**
     * Loads {@code sql/migration/<stem>.sql}. The stem has the form
     * {@code NNN-name}; version and name are taken from it.
     */
    public static Migration fromResource(String stem) {
        int dash = stem.indexOf('-');
        if (dash <= 0 || dash == stem.length() - 1)
            throw new IllegalArgumentException("Migration resource must be named NNN-name: " + stem);
        int version;
        try {
            version = Integer.parseInt(stem.substring(0, dash));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Migration resource must start with a version number: " + stem, e);
        }
        return new Migration(version, stem.substring(dash + 1), SqlLoader.statements("migration/" + stem));
    }
}
