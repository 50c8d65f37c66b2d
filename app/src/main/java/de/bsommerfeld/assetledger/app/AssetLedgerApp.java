package de.bsommerfeld.assetledger.app;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.app.backup.AutoBackupService;
import de.bsommerfeld.assetledger.core.config.BackupConfig;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.MigrationException;
import de.bsommerfeld.assetledger.db.MigrationRunner;
import de.bsommerfeld.assetledger.db.account.Authenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application lifecycle: bring the store up to date, start background work,
 * and tear everything down again in reverse order.
 *
 * <p>
 * {@link #start()} binds the store connection to the calling thread, which
 * becomes the coordinating thread that owns the {@link Session}.
 */
@Singleton
public class AssetLedgerApp {

    private static final Logger LOG = LoggerFactory.getLogger(AssetLedgerApp.class);

    private final ConnectionManager connectionManager;
    private final MigrationRunner migrationRunner;
    private final AutoBackupService autoBackup;
    private final BackupConfig backupConfig;
    private final Authenticator authenticator;
    private final Session session;

    private boolean running;

    @Inject
    public AssetLedgerApp(ConnectionManager connectionManager, MigrationRunner migrationRunner,
            AutoBackupService autoBackup, BackupConfig backupConfig, Authenticator authenticator, Session session) {
        this.connectionManager = connectionManager;
        this.migrationRunner = migrationRunner;
        this.autoBackup = autoBackup;
        this.backupConfig = backupConfig;
        this.authenticator = authenticator;
        this.session = session;
    }

    /**
     * Opens the store, applies pending migrations and starts auto-backup.
     *
     * @throws MigrationException if the schema cannot be brought up to date;
     *                            the store is closed again and the
     *                            application must not continue
     */
    public synchronized void start() {
        if (running)
            return;
        LOG.info("Starting Asset Ledger, store at {}", connectionManager.storePath());
        connectionManager.open();
        try {
            migrationRunner.runAll();
        } catch (MigrationException e) {
            LOG.error("Schema migration {} failed, refusing to start", e.getVersion(), e);
            connectionManager.closeAll();
            throw e;
        }

        if (backupConfig.isAutoBackupEnabled()) {
            autoBackup.start();
        } else {
            LOG.info("Auto-backup disabled");
        }
        running = true;
        LOG.info("Asset Ledger started");
    }

    /** Logs out, stops background work and closes every store connection. */
    public synchronized void stop() {
        if (!running)
            return;
        LOG.info("Stopping Asset Ledger...");
        authenticator.logout(session);
        autoBackup.shutdown();
        connectionManager.closeAll();
        running = false;
        LOG.info("Asset Ledger stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }
}
