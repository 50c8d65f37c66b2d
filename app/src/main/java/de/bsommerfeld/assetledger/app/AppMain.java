package de.bsommerfeld.assetledger.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.assetledger.app.config.AppModule;
import de.bsommerfeld.assetledger.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Starts the application and keeps it alive until the
 * JVM is asked to exit.
 */
public final class AppMain {

    static {
        // Must run before the first logger is created; logback.xml reads LOG_DIR.
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AppMain.class);

    private AppMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        AssetLedgerApp app;
        try {
            Injector injector = Guice.createInjector(new AppModule());
            app = injector.getInstance(AssetLedgerApp.class);
            app.start();
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            app.stop();
            stopped.countDown();
        }, "shutdown"));
        stopped.await();
    }
}
