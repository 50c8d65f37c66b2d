package de.bsommerfeld.assetledger.db;

import de.bsommerfeld.assetledger.core.config.DatabaseConfig;
import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Principal;
import de.bsommerfeld.assetledger.core.session.Session;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Shared setup for integration tests: a migrated store in a temp directory,
 * opened on the test thread.
 */
public final class StoreFixture {

    /** The seeded administrator created by the initial data migration. */
    public static final long ADMIN_ID = 1L;
    public static final long ADMIN_ROLE_ID = 1L;

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneId.of("UTC"));
    public static final String FIXED_NOW = "2024-03-01 10:15:30";

    private StoreFixture() {
    }

    /** Opens a store at {@code dir/test.db}, migrated to the current schema. */
    public static ConnectionManager migratedStore(Path dir) {
        ConnectionManager cm = new ConnectionManager(dir.resolve("test.db"), new DatabaseConfig(),
                manager -> new MigrationRunner(manager).runAll());
        cm.open();
        return cm;
    }

    public static Session adminSession() {
        return Session.of(new Principal(ADMIN_ID, "admin", "System administrator", ADMIN_ROLE_ID,
                "Administrator", EnumSet.allOf(Permission.class)));
    }

    public static Session sessionWith(long principalId, Set<Permission> permissions) {
        return Session.of(new Principal(principalId, "user" + principalId, "Test User", 2L, "Operator",
                permissions));
    }
}
