package de.bsommerfeld.assetledger.db;

import java.util.List;

/**
 * The application's migrations in version order. New migrations are added as
 * {@code sql/migration/NNN-name.sql} and listed here; applied ones are never
 * edited.
 */
public final class Migrations {

    private static final List<String> RESOURCES = List.of(
            "001-initial_schema",
            "002-add_indexes",
            "003-initial_data");

    private Migrations() {
    }

    public static List<Migration> all() {
        return RESOURCES.stream().map(Migration::fromResource).toList();
    }
}
