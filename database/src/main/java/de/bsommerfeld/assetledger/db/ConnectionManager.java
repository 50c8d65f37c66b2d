package de.bsommerfeld.assetledger.db;

import de.bsommerfeld.assetledger.core.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Owns the connections to the embedded SQLite store.
 *
 * <h3>Connection strategy</h3>
 * One physical {@link Connection} per thread, never shared. SQLite connection
 * objects must not be used from two threads at once, so every thread that
 * touches the store calls {@link #open()} once when it starts working and
 * {@link #close()} when it is done. There is no implicit creation: any other
 * method called on a thread without an open connection fails with
 * {@link IllegalStateException}.
 *
 * <h3>Pragmas</h3>
 * Applied once per new connection through {@link SQLiteConfig}: foreign keys
 * on, WAL journal, {@code synchronous=NORMAL}, bounded page cache, temp
 * storage in memory, a busy timeout, and {@code BEGIN IMMEDIATE} for
 * transactions. WAL lets readers proceed while a writer commits; writers are
 * serialized by SQLite's own lock. Immediate transactions take that lock up
 * front, so a read-then-write unit of work cannot fail halfway with
 * {@code SQLITE_BUSY} when another writer got there first.
 *
 * <h3>Transaction boundaries</h3>
 * Outside {@link #transaction} every statement auto-commits. Nested
 * {@code transaction} calls on the same thread join the outer one; if inner
 * work fails, the outer transaction is rolled back even if the caller catches
 * the exception.
 *
 * <h3>Failures</h3>
 * Failing statements are logged with SQL and parameters, then rethrown as
 * {@link PersistenceException} or, for constraint violations,
 * {@link ConstraintViolationException}.
 *
 * @see MigrationRunner
 * @see RecordStore
 */
public class ConnectionManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final Pattern BACKUP_NAME = Pattern.compile("backup_(\\d{8}_\\d{6})(?:_(\\d+))?\\.db");

    /**
     * Creation order of backup files: by timestamp, then by the numeric
     * same-second suffix ({@code _2} before {@code _10}). Files that do not
     * follow the backup naming sort first.
     */
    public static final Comparator<Path> BACKUP_ORDER = Comparator
            .comparing(ConnectionManager::backupStamp)
            .thenComparingInt(ConnectionManager::backupSuffix);

    private final Path storePath;
    private final String dbUrl;
    private final Properties connectionProperties;
    private final SchemaInitializer initializer;
    private final boolean storeExisted;
    private final Object initLock = new Object();
    private volatile boolean initialized;

    private final ThreadLocal<ThreadConnection> local = new ThreadLocal<>();
    private final Set<ThreadConnection> openConnections = ConcurrentHashMap.newKeySet();

    /**
     * @param storePath   the store file; parent directories are created
     * @param settings    busy timeout and cache size
     * @param initializer run on the first {@link #open()} if {@code storePath}
     *                    did not exist yet
     */
    public ConnectionManager(Path storePath, DatabaseConfig settings, SchemaInitializer initializer) {
        this.storePath = storePath.toAbsolutePath();
        this.initializer = initializer;
        try {
            Path parent = this.storePath.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new PersistenceException("Failed to create store directory for " + this.storePath, e);
        }
        this.storeExisted = Files.exists(this.storePath);
        this.dbUrl = "jdbc:sqlite:" + this.storePath;
        this.connectionProperties = sqliteConfig(settings).toProperties();

        if (storeExisted) {
            LOG.info("Using existing store at {}", this.storePath);
        } else {
            LOG.info("Store {} does not exist yet, it will be created on first open", this.storePath);
        }
    }

    private static SQLiteConfig sqliteConfig(DatabaseConfig settings) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setCacheSize(settings.getCacheSize());
        config.setTempStore(SQLiteConfig.TempStore.MEMORY);
        config.setBusyTimeout(settings.getBusyTimeoutMs());
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return config;
    }

    public Path storePath() {
        return storePath;
    }

    // =====================================================================
    // Connection Lifecycle
    // =====================================================================

    /**
     * Binds a connection to the calling thread. Calling it again on the same
     * thread returns the already bound connection.
     *
     * <p>
     * On the first open of a store that did not exist when this manager was
     * created, the {@link SchemaInitializer} runs before this method returns.
     * If it fails, the connection is closed again and the failure propagates;
     * the next {@code open()} retries.
     *
     * <p>
     * The returned connection belongs to this manager. Do not close it
     * directly, use {@link #close()}.
     */
    public Connection open() {
        ThreadConnection current = local.get();
        if (current != null && !current.isClosed()) {
            return current.connection;
        }
        if (current != null) {
            forget(current);
        }

        Connection conn;
        try {
            conn = DriverManager.getConnection(dbUrl, connectionProperties);
        } catch (SQLException e) {
            LOG.error("Failed to open store {}", storePath, e);
            throw new PersistenceException("Failed to open store " + storePath, e);
        }
        ThreadConnection bound = new ThreadConnection(conn, Thread.currentThread().getName());
        local.set(bound);
        openConnections.add(bound);
        LOG.debug("Opened connection on thread '{}'", bound.threadName);

        initializeIfNew();
        return conn;
    }

    private void initializeIfNew() {
        if (storeExisted || initialized)
            return;
        synchronized (initLock) {
            if (initialized)
                return;
            LOG.info("Initializing new store at {}", storePath);
            try {
                initializer.initialize(this);
            } catch (RuntimeException e) {
                LOG.error("Store initialization failed", e);
                close();
                throw e;
            }
            initialized = true;
        }
    }

    /**
     * Returns the connection bound to the calling thread.
     *
     * @throws IllegalStateException if {@link #open()} was not called on this
     *                               thread
     */
    public Connection connection() {
        return current().connection;
    }

    /** Returns {@code true} if the calling thread has an open connection. */
    public boolean isOpen() {
        ThreadConnection current = local.get();
        return current != null && !current.isClosed();
    }

    private ThreadConnection current() {
        ThreadConnection current = local.get();
        if (current == null || current.isClosed()) {
            throw new IllegalStateException("No open store connection on thread '"
                    + Thread.currentThread().getName() + "', call open() first");
        }
        return current;
    }

    /**
     * Releases the calling thread's connection. Does nothing if there is none.
     */
    public void close() {
        ThreadConnection current = local.get();
        if (current == null)
            return;
        forget(current);
        closePhysical(current);
    }

    /**
     * Closes every connection this manager handed out, on any thread. Only
     * meant for application shutdown: threads still working will fail on
     * their next statement.
     */
    public void closeAll() {
        for (ThreadConnection c : new ArrayList<>(openConnections)) {
            openConnections.remove(c);
            closePhysical(c);
        }
        local.remove();
        LOG.info("All store connections closed");
    }

    private void forget(ThreadConnection c) {
        local.remove();
        openConnections.remove(c);
    }

    private void closePhysical(ThreadConnection c) {
        try {
            if (!c.connection.isClosed()) {
                c.connection.close();
                LOG.debug("Closed connection of thread '{}'", c.threadName);
            }
        } catch (SQLException e) {
            LOG.warn("Failed to close connection of thread '{}'", c.threadName, e);
        }
    }

    // =====================================================================
    // Statements
    // =====================================================================

    /**
     * Executes a data-modifying or DDL statement.
     *
     * @return the number of affected rows
     */
    public int execute(String sql, Object... params) {
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            SqlValues.bind(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw failure(e, sql, params);
        }
    }

    /**
     * Executes an INSERT and returns the rowid of the new row.
     */
    public long insert(String sql, Object... params) {
        Connection conn = connection();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            SqlValues.bind(ps, params);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw failure(e, sql, params);
        }
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw failure(e, "SELECT last_insert_rowid()");
        }
    }

    /**
     * Executes the same statement once per parameter row as a JDBC batch.
     *
     * @return affected row counts per parameter row
     */
    public int[] executeMany(String sql, List<Object[]> paramRows) {
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            for (Object[] row : paramRows) {
                SqlValues.bind(ps, row);
                ps.addBatch();
            }
            return ps.executeBatch();
        } catch (SQLException e) {
            LOG.error("Batch failed: {} | SQL: {} | Rows: {}", e.getMessage(), sql, describeRows(paramRows));
            throw translate(e, sql);
        }
    }

    private static String describeRows(List<Object[]> paramRows) {
        return paramRows.stream()
                .map(SqlValues::describe)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    /** Returns the first row of the result, or {@code null} if there is none. */
    public Record fetchOne(String sql, Object... params) {
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            SqlValues.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? SqlValues.readRow(rs) : null;
            }
        } catch (SQLException e) {
            throw failure(e, sql, params);
        }
    }

    public List<Record> fetchAll(String sql, Object... params) {
        List<Record> rows = new ArrayList<>();
        try (PreparedStatement ps = connection().prepareStatement(sql)) {
            SqlValues.bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(SqlValues.readRow(rs));
                }
            }
        } catch (SQLException e) {
            throw failure(e, sql, params);
        }
        return rows;
    }

    private PersistenceException failure(SQLException e, String sql, Object... params) {
        LOG.error("Query failed: {} | SQL: {} | Params: {}", e.getMessage(), sql, SqlValues.describe(params));
        return translate(e, sql);
    }

    static PersistenceException translate(SQLException e, String context) {
        if (isConstraintViolation(e)) {
            return new ConstraintViolationException("Constraint violated: " + e.getMessage(), e);
        }
        return new PersistenceException("Statement failed: " + context, e);
    }

    /** Batch failures wrap the driver's exception, so the cause chain is checked too. */
    private static boolean isConstraintViolation(SQLException e) {
        int constraint = SQLiteErrorCode.SQLITE_CONSTRAINT.code;
        for (Throwable t = e; t instanceof SQLException; t = t.getCause()) {
            if (t instanceof SQLiteException) {
                if ((((SQLiteException) t).getResultCode().code & 0xff) == constraint)
                    return true;
            } else if ((((SQLException) t).getErrorCode() & 0xff) == constraint) {
                return true;
            }
        }
        return false;
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    /**
     * Runs {@code work} inside a transaction on the calling thread's
     * connection: commit on normal return, rollback on any exception. The
     * caller always sees the original failure; {@link SQLException}s arrive
     * wrapped in {@link PersistenceException}. Auto-commit is restored on
     * every exit path.
     */
    public <T> T transaction(TransactionWork<T> work) {
        ThreadConnection tc = current();
        if (tc.depth > 0) {
            return joinTransaction(tc, work);
        }

        Connection conn = tc.connection;
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw failure(e, "BEGIN");
        }
        tc.depth = 1;
        tc.rollbackOnly = false;
        try {
            T result = work.execute(conn);
            if (tc.rollbackOnly) {
                throw new PersistenceException("Transaction marked rollback-only by failed nested work");
            }
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(conn, e);
            throw translate(e, "transaction");
        } catch (RuntimeException | Error e) {
            rollback(conn, e);
            throw e;
        } finally {
            tc.depth = 0;
            tc.rollbackOnly = false;
            restoreAutoCommit(conn);
        }
    }

    private <T> T joinTransaction(ThreadConnection tc, TransactionWork<T> work) {
        tc.depth++;
        try {
            return work.execute(tc.connection);
        } catch (SQLException e) {
            tc.rollbackOnly = true;
            throw translate(e, "nested transaction");
        } catch (RuntimeException | Error e) {
            tc.rollbackOnly = true;
            throw e;
        } finally {
            tc.depth--;
        }
    }

    /** Returns {@code true} while the calling thread is inside {@link #transaction}. */
    public boolean inTransaction() {
        ThreadConnection current = local.get();
        return current != null && current.depth > 0;
    }

    private void rollback(Connection conn, Throwable cause) {
        LOG.error("Transaction rolled back: {}", cause.toString());
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.error("Rollback failed", e);
            cause.addSuppressed(e);
        }
    }

    private void restoreAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.error("Failed to restore auto-commit", e);
        }
    }

    // =====================================================================
    // Backup / Restore
    // =====================================================================

    /**
     * Writes a consistent point-in-time copy of the store to
     * {@code destinationDir/backup_<yyyyMMdd_HHmmss>.db} using SQLite's online
     * backup. Other connections may keep reading and writing meanwhile.
     *
     * @return the created backup file
     */
    public Path backup(Path destinationDir) {
        Connection conn = connection();
        Path target;
        try {
            Files.createDirectories(destinationDir);
            target = nextBackupFile(destinationDir.toAbsolutePath());
        } catch (IOException e) {
            LOG.error("Failed to prepare backup directory {}", destinationDir, e);
            throw new PersistenceException("Failed to prepare backup directory " + destinationDir, e);
        }

        String command = "backup to " + quote(target.toString());
        try (Statement st = conn.createStatement()) {
            st.executeUpdate(command);
        } catch (SQLException e) {
            throw failure(e, command);
        }
        LOG.info("Backup created: {}", target);
        return target;
    }

    /**
     * Backups taken within the same second get a suffix one higher than any
     * existing one, so {@link #BACKUP_ORDER} stays creation order even after
     * older files of that second were pruned.
     */
    private static Path nextBackupFile(Path dir) throws IOException {
        String stamp = LocalDateTime.now().format(BACKUP_STAMP);
        int highest = -1;
        try (DirectoryStream<Path> same = Files.newDirectoryStream(dir, "backup_" + stamp + "*.db")) {
            for (Path p : same) {
                if (stamp.equals(backupStamp(p)))
                    highest = Math.max(highest, backupSuffix(p));
            }
        }
        String stem = "backup_" + stamp;
        return highest < 0 ? dir.resolve(stem + ".db") : dir.resolve(stem + "_" + (highest + 1) + ".db");
    }

    private static String backupStamp(Path file) {
        Matcher m = BACKUP_NAME.matcher(file.getFileName().toString());
        return m.matches() ? m.group(1) : "";
    }

    /** The same-second suffix; 0 for the first backup of a second and for foreign names. */
    private static int backupSuffix(Path file) {
        Matcher m = BACKUP_NAME.matcher(file.getFileName().toString());
        return m.matches() && m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
    }

    private static String quote(String path) {
        if (!path.contains("'"))
            return "'" + path + "'";
        if (!path.contains("\""))
            return "\"" + path + "\"";
        throw new IllegalArgumentException("Backup path must not contain both quote characters: " + path);
    }

    /**
     * Replaces the live store with {@code backupPath}. Closes the calling
     * thread's connection first; call {@link #open()} afterwards to continue.
     *
     * <p>
     * Connections held by other threads are not coordinated. Restoring while
     * another thread has the store open gives undefined results, so callers
     * must stop background work before restoring.
     *
     * @throws NotFoundException if {@code backupPath} does not exist
     */
    public void restore(Path backupPath) {
        if (!Files.exists(backupPath)) {
            throw new NotFoundException("Backup file not found: " + backupPath);
        }
        close();
        try {
            // A leftover WAL would be replayed on top of the restored file.
            Files.deleteIfExists(Path.of(storePath + "-wal"));
            Files.deleteIfExists(Path.of(storePath + "-shm"));
            Files.copy(backupPath, storePath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            LOG.error("Failed to restore store from {}", backupPath, e);
            throw new PersistenceException("Failed to restore store from " + backupPath, e);
        }
        LOG.info("Store restored from {}", backupPath);
    }

    /** Per-thread connection plus its transaction nesting state. */
    private static final class ThreadConnection {
        final Connection connection;
        final String threadName;
        int depth;
        boolean rollbackOnly;

        ThreadConnection(Connection connection, String threadName) {
            this.connection = connection;
            this.threadName = threadName;
        }

        boolean isClosed() {
            try {
                return connection.isClosed();
            } catch (SQLException e) {
                return true;
            }
        }
    }
}
