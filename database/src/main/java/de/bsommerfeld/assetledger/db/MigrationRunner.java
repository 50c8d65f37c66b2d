package de.bsommerfeld.assetledger.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies pending migrations and records them in the {@code migrations}
 * ledger.
 *
 * <p>
 * Each migration runs in its own transaction together with its ledger row, so
 * a failing statement leaves neither partial schema nor a ledger entry
 * behind. {@link #runAll()} is safe to call on every startup.
 *
 * <p>
 * Runs on the calling thread's connection; the thread must have called
 * {@link ConnectionManager#open()}.
 */
public class MigrationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationRunner.class);

    private final ConnectionManager connectionManager;
    private final List<Migration> migrations;

    public MigrationRunner(ConnectionManager connectionManager) {
        this(connectionManager, Migrations.all());
    }

    /**
     * @throws IllegalArgumentException if two migrations share a version
     */
    public MigrationRunner(ConnectionManager connectionManager, List<Migration> migrations) {
        this.connectionManager = connectionManager;
        Set<Integer> seen = new HashSet<>();
        for (Migration m : migrations) {
            if (!seen.add(m.version()))
                throw new IllegalArgumentException("Duplicate migration version " + m.version());
        }
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(Migration::version));
        this.migrations = List.copyOf(sorted);
    }

    public List<Migration> migrations() {
        return migrations;
    }

    /** Versions recorded in the ledger, ascending. Creates the ledger if missing. */
    public Set<Integer> appliedVersions() {
        ensureLedger();
        Set<Integer> versions = new LinkedHashSet<>();
        for (Record row : connectionManager.fetchAll(SqlLoader.load("select-applied-versions"))) {
            versions.add(row.getLong("version").intValue());
        }
        return versions;
    }

    /**
     * Applies one migration: all statements plus the ledger row in a single
     * transaction.
     *
     * @throws MigrationException if any statement fails; nothing is kept
     */
    public void apply(Migration migration) {
        ensureLedger();
        LOG.info("Applying migration {}: {}", migration.version(), migration.name());
        try {
            connectionManager.transaction(conn -> {
                for (String statement : migration.statements()) {
                    connectionManager.execute(statement);
                }
                connectionManager.execute(SqlLoader.load("insert-migration"), migration.version(), migration.name());
                return null;
            });
        } catch (PersistenceException e) {
            LOG.error("Migration {} '{}' failed", migration.version(), migration.name(), e);
            throw new MigrationException(migration.version(),
                    "Migration " + migration.version() + " '" + migration.name() + "' failed", e);
        }
        LOG.info("Migration {} '{}' applied", migration.version(), migration.name());
    }

    /**
     * Applies every migration not yet in the ledger, in ascending version
     * order. Stops at the first failure.
     *
     * @return the number of migrations applied by this call
     */
    public int runAll() {
        Set<Integer> applied = appliedVersions();
        int count = 0;
        for (Migration migration : migrations) {
            if (applied.contains(migration.version()))
                continue;
            apply(migration);
            count++;
        }
        if (count == 0) {
            LOG.info("Schema is up to date ({} migrations applied)", applied.size());
        } else {
            LOG.info("Applied {} migration(s)", count);
        }
        return count;
    }

    private void ensureLedger() {
        connectionManager.execute(SqlLoader.load("create-migration-ledger"));
    }
}
