package de.bsommerfeld.assetledger.app.backup;

import de.bsommerfeld.assetledger.core.config.BackupConfig;
import de.bsommerfeld.assetledger.core.config.DatabaseConfig;
import de.bsommerfeld.assetledger.core.event.ApplicationEventBus;
import de.bsommerfeld.assetledger.core.event.BackupEvents;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.MigrationRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AutoBackupServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private ApplicationEventBus eventBus;

    private ConnectionManager cm;
    private BackupConfig config;
    private AutoBackupService service;
    private Path backupDir;

    @BeforeEach
    void setUp() {
        cm = new ConnectionManager(tempDir.resolve("store.db"), new DatabaseConfig(),
                manager -> new MigrationRunner(manager).runAll());
        cm.open();
        config = new BackupConfig();
        config.setRetain(2);
        backupDir = tempDir.resolve("backups");
        service = new AutoBackupService(cm, backupDir, config, eventBus);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        cm.closeAll();
    }

    @Test
    void backupNow_shouldCreateFileAndPostEvent() throws Exception {
        Path file = service.backupNow().get();

        assertTrue(Files.exists(file));
        assertEquals(backupDir, file.getParent());
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).post(event.capture());
        BackupEvents.BackupCreatedEvent created = assertInstanceOf(BackupEvents.BackupCreatedEvent.class,
                event.getValue());
        assertEquals(file, created.file());
        assertEquals(0, created.pruned());
    }

    @Test
    void backupNow_shouldPruneBeyondRetention() throws Exception {
        Path first = service.backupNow().get();
        service.backupNow().get();
        Path third = service.backupNow().get();
        Path fourth = service.backupNow().get();

        List<Path> remaining = listBackups();
        assertEquals(2, remaining.size());
        assertFalse(Files.exists(first));
        assertEquals(List.of(third, fourth), remaining);
    }

    @Test
    void backupNow_shouldContainCommittedData() throws Exception {
        cm.insert("INSERT INTO departments (code, name) VALUES (?, ?)", "AB", "Supply");
        Path file = service.backupNow().get();

        ConnectionManager copy = new ConnectionManager(file, new DatabaseConfig(), manager -> {
        });
        copy.open();
        try {
            assertEquals("Supply", copy.fetchOne("SELECT name FROM departments WHERE code = ?", "AB").getString("name"));
            assertNotNull(copy.fetchOne("SELECT id FROM users WHERE username = ?", "admin"));
        } finally {
            copy.closeAll();
        }
    }

    @Test
    void backupNow_failureShouldPostFailedEvent() {
        service.shutdown();
        service = new AutoBackupService(cm, tempDir.resolve("store.db").resolve("not-a-dir"), config, eventBus);

        ExecutionException e = assertThrows(ExecutionException.class, () -> service.backupNow().get());
        assertNotNull(e.getCause());
        verify(eventBus, atLeastOnce()).post(any(BackupEvents.BackupFailedEvent.class));
    }

    @Test
    void start_shouldScheduleOnceAndShutdownShouldStop() {
        service.start();
        service.start();
        assertTrue(service.isScheduled());

        service.shutdown();
        assertFalse(service.isScheduled());
        verify(eventBus, times(0)).post(any());
    }

    @Test
    void prune_shouldKeepHighestSameSecondSuffix() throws Exception {
        Files.createDirectories(backupDir);
        Files.createFile(backupDir.resolve("backup_20240101_120000.db"));
        for (int i = 1; i <= 10; i++) {
            Files.createFile(backupDir.resolve("backup_20240101_120000_" + i + ".db"));
        }
        config.setRetain(1);

        assertEquals(10, service.prune());

        List<Path> remaining = listBackups();
        assertEquals(List.of(backupDir.resolve("backup_20240101_120000_10.db")), remaining);
    }

    @Test
    void prune_shouldOrderByTimestampBeforeSuffix() throws Exception {
        Files.createDirectories(backupDir);
        Files.createFile(backupDir.resolve("backup_20240101_120000_12.db"));
        Files.createFile(backupDir.resolve("backup_20240101_120001.db"));
        Files.createFile(backupDir.resolve("backup_20240101_120001_3.db"));

        assertEquals(1, service.prune());

        assertFalse(Files.exists(backupDir.resolve("backup_20240101_120000_12.db")));
        assertTrue(Files.exists(backupDir.resolve("backup_20240101_120001_3.db")));
    }

    private List<Path> listBackups() throws Exception {
        try (Stream<Path> files = Files.list(backupDir)) {
            return files.sorted(ConnectionManager.BACKUP_ORDER).collect(Collectors.toList());
        }
    }
}
