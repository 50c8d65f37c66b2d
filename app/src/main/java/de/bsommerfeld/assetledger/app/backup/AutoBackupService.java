package de.bsommerfeld.assetledger.app.backup;

import de.bsommerfeld.assetledger.core.config.BackupConfig;
import de.bsommerfeld.assetledger.core.event.ApplicationEventBus;
import de.bsommerfeld.assetledger.core.event.BackupEvents;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic online backups of the store.
 *
 * <h3>Thread model</h3>
 * All work runs on one dedicated daemon thread that opens its own store
 * connection on first use and keeps it until {@link #shutdown()}. Backups
 * do not block readers on other threads; writers wait only while the
 * snapshot is copied.
 *
 * <h3>Retention</h3>
 * After each backup, files named {@code backup_*.db} in the backup directory
 * beyond the configured count are deleted, oldest first.
 *
 * <h3>Failures</h3>
 * A failed scheduled backup is logged and announced with
 * {@link BackupEvents.BackupFailedEvent}; the schedule keeps running.
 */
public class AutoBackupService {

    private static final Logger LOG = LoggerFactory.getLogger(AutoBackupService.class);
    private static final String BACKUP_GLOB = "backup_*.db";

    private final ConnectionManager connectionManager;
    private final Path backupDir;
    private final BackupConfig config;
    private final ApplicationEventBus eventBus;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "auto-backup");
        t.setDaemon(true);
        return t;
    });
    private ScheduledFuture<?> schedule;

    public AutoBackupService(ConnectionManager connectionManager, Path backupDir, BackupConfig config,
            ApplicationEventBus eventBus) {
        this.connectionManager = connectionManager;
        this.backupDir = backupDir;
        this.config = config;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    /** Schedules backups at the configured interval. Calling it twice has no effect. */
    public synchronized void start() {
        if (schedule != null)
            return;
        long interval = Math.max(1, config.getIntervalMinutes());
        schedule = scheduler.scheduleWithFixedDelay(this::runScheduled, interval, interval, TimeUnit.MINUTES);
        LOG.info("Auto-backup every {} min into {} (keeping {})", interval, backupDir, config.getRetain());
    }

    public synchronized boolean isScheduled() {
        return schedule != null && !schedule.isCancelled();
    }

    /**
     * Stops the schedule, releases the worker's connection and waits up to
     * 30s for a running backup to finish.
     */
    public synchronized void shutdown() {
        if (scheduler.isShutdown())
            return;
        LOG.info("Shutting down auto-backup...");
        if (schedule != null)
            schedule.cancel(false);
        scheduler.execute(connectionManager::close);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                LOG.warn("Auto-backup forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // =====================================================================
    // Backup
    // =====================================================================

    /**
     * Runs a backup on the worker thread right away.
     *
     * @return the created file; the future fails if the backup failed
     */
    public Future<Path> backupNow() {
        return scheduler.submit(this::backupOnWorker);
    }

    private void runScheduled() {
        try {
            backupOnWorker();
        } catch (RuntimeException e) {
            LOG.error("Scheduled backup failed, retrying at next interval", e);
        }
    }

    private Path backupOnWorker() {
        try {
            connectionManager.open();
            Path file = connectionManager.backup(backupDir);
            int pruned = prune();
            eventBus.post(new BackupEvents.BackupCreatedEvent(file, pruned));
            return file;
        } catch (RuntimeException e) {
            eventBus.post(new BackupEvents.BackupFailedEvent(String.valueOf(e.getMessage())));
            throw e;
        }
    }

    /**
     * Deletes the oldest backups beyond the retention count, ordered by
     * {@link ConnectionManager#BACKUP_ORDER}.
     *
     * @return the number of deleted files
     */
    int prune() {
        int retain = config.getRetain();
        if (retain <= 0)
            return 0;

        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, BACKUP_GLOB)) {
            stream.forEach(backups::add);
        } catch (IOException e) {
            throw new PersistenceException("Failed to list backups in " + backupDir, e);
        }
        backups.sort(ConnectionManager.BACKUP_ORDER);

        int pruned = 0;
        for (int i = 0; i < backups.size() - retain; i++) {
            Path old = backups.get(i);
            try {
                Files.deleteIfExists(old);
                pruned++;
                LOG.debug("Pruned old backup {}", old.getFileName());
            } catch (IOException e) {
                LOG.warn("Failed to delete old backup {}", old, e);
            }
        }
        if (pruned > 0)
            LOG.info("Pruned {} old backup(s), keeping {}", pruned, retain);
        return pruned;
    }
}
