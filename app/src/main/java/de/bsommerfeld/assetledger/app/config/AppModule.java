package de.bsommerfeld.assetledger.app.config;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.app.backup.AutoBackupService;
import de.bsommerfeld.assetledger.core.config.ApplicationMode;
import de.bsommerfeld.assetledger.core.config.BackupConfig;
import de.bsommerfeld.assetledger.core.config.ConfigLoader;
import de.bsommerfeld.assetledger.core.config.ConfigurationException;
import de.bsommerfeld.assetledger.core.config.DatabaseConfig;
import de.bsommerfeld.assetledger.core.config.GlobalConfig;
import de.bsommerfeld.assetledger.core.config.SecurityConfig;
import de.bsommerfeld.assetledger.core.config.UserConfig;
import de.bsommerfeld.assetledger.core.event.ApplicationEventBus;
import de.bsommerfeld.assetledger.core.security.BcryptPasswordHasher;
import de.bsommerfeld.assetledger.core.security.PasswordHasher;
import de.bsommerfeld.assetledger.core.util.StorageUtils;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.MigrationRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module for application wiring.
 *
 * <p>
 * Everything on disk (configuration, store, backups) lives below one
 * application data directory. In {@link ApplicationMode#TEST} that is a fresh
 * temporary directory, so test runs never touch real data.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path appDataDir;

    public AppModule() {
        this(defaultAppDataDir(ApplicationMode.get()));
    }

    public AppModule(Path appDataDir) {
        this.appDataDir = appDataDir.toAbsolutePath();
    }

    private static Path defaultAppDataDir(ApplicationMode mode) {
        LOG.info("Application Mode initialized: {}", mode);
        if (!mode.isTest()) {
            return StorageUtils.getAppDataDir(StorageUtils.APP_NAME);
        }
        try {
            return Files.createTempDirectory(StorageUtils.APP_NAME + "-test");
        } catch (IOException e) {
            throw new ConfigurationException("Failed to create temporary data directory", e);
        }
    }

    @Override
    protected void configure() {
        Path configPath = appDataDir.resolve("config.toml");
        LOG.info("Loading Configuration from: {}", configPath);
        GlobalConfig config = ConfigLoader.load(configPath);

        bind(GlobalConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(BackupConfig.class).toInstance(config.getBackup());
        bind(SecurityConfig.class).toInstance(config.getSecurity());
        bind(UserConfig.class).toInstance(config.getUser());

        bind(PasswordHasher.class).to(BcryptPasswordHasher.class);
    }

    /**
     * The store, set up so that a newly created file is migrated on its
     * first open.
     */
    @Provides
    @Singleton
    ConnectionManager connectionManager(DatabaseConfig databaseConfig) {
        Path storePath = StorageUtils.resolve(appDataDir, databaseConfig.getFile());
        return new ConnectionManager(storePath, databaseConfig, manager -> new MigrationRunner(manager).runAll());
    }

    @Provides
    MigrationRunner migrationRunner(ConnectionManager connectionManager) {
        return new MigrationRunner(connectionManager);
    }

    @Provides
    @Singleton
    AutoBackupService autoBackupService(ConnectionManager connectionManager, BackupConfig backupConfig,
            ApplicationEventBus eventBus) {
        Path backupDir = StorageUtils.resolve(appDataDir, backupConfig.getDirectory());
        return new AutoBackupService(connectionManager, backupDir, backupConfig, eventBus);
    }

    public Path appDataDir() {
        return appDataDir;
    }
}
