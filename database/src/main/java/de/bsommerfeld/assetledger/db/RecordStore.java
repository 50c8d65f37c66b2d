package de.bsommerfeld.assetledger.db;

import de.bsommerfeld.assetledger.core.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Generic CRUD over one table, with every mutation written to the
 * {@link AuditLog} in the same transaction.
 *
 * <p>
 * One instance per {@link TableDescriptor}; entity specific behaviour lives
 * in services that compose a store (see {@code UserAccounts},
 * {@code NomenclatureCatalog}). The store itself checks no permissions.
 *
 * <h3>Column safety</h3>
 * Column names in fields, criteria and sorts are checked against the
 * descriptor before any SQL is built, and only then interpolated. Every value
 * is a bound parameter, including limit and offset.
 *
 * <h3>Auto-filled columns</h3>
 * On create, {@code created_at} and {@code updated_at} default to now and
 * {@code created_by} to the session's principal. On update, {@code updated_at}
 * is always set to now and {@code updated_by} defaults to the principal.
 * Values the caller supplies win, except for {@code updated_at} on update.
 * Only columns the descriptor declares are filled. Caller maps are never
 * modified.
 *
 * <h3>Auditing</h3>
 * Mutations by an authenticated session produce exactly one entry; if
 * writing the entry fails, the data change is rolled back as well. Without an
 * acting principal nothing is audited. Redacted columns appear in entries
 * with the value {@value #REDACTED}.
 */
public class RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(RecordStore.class);

    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String CREATED_BY = "created_by";
    public static final String UPDATED_BY = "updated_by";
    public static final String REDACTED = "[redacted]";

    private final ConnectionManager connectionManager;
    private final AuditLog auditLog;
    private final TableDescriptor table;
    private final Clock clock;

    public RecordStore(ConnectionManager connectionManager, AuditLog auditLog, TableDescriptor table, Clock clock) {
        this.connectionManager = connectionManager;
        this.auditLog = auditLog;
        this.table = table;
        this.clock = clock;
    }

    public TableDescriptor table() {
        return table;
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Inserts a row.
     *
     * @return the generated primary key
     * @throws IllegalArgumentException     on a column the table does not
     *                                      declare as writable
     * @throws ConstraintViolationException on unique, foreign key or check
     *                                      violations
     */
    public long create(Session session, Map<String, ?> fields) {
        checkWritable(fields);
        Map<String, Object> values = SqlValues.normalize(fields);
        String now = Timestamps.now(clock);
        Long actor = session.principalId();
        fillIfAbsent(values, CREATED_AT, now);
        fillIfAbsent(values, UPDATED_AT, now);
        if (actor != null)
            fillIfAbsent(values, CREATED_BY, actor);

        String sql;
        if (values.isEmpty()) {
            sql = "INSERT INTO " + table.name() + " DEFAULT VALUES";
        } else {
            StringJoiner cols = new StringJoiner(", ");
            StringJoiner marks = new StringJoiner(", ");
            for (String column : values.keySet()) {
                cols.add(column);
                marks.add("?");
            }
            sql = "INSERT INTO " + table.name() + " (" + cols + ") VALUES (" + marks + ")";
        }
        Object[] params = values.values().toArray();

        long id = connectionManager.transaction(conn -> {
            long newId = connectionManager.insert(sql, params);
            if (actor != null) {
                auditLog.append(actor, AuditAction.CREATE, table.name(), newId, null, auditView(values));
            }
            return newId;
        });
        if (actor == null)
            LOG.warn("Unaudited create in {} (id {}): no acting principal", table.name(), id);
        LOG.debug("Created {}#{}", table.name(), id);
        return id;
    }

    /**
     * Updates the given columns of one row.
     *
     * @return {@code false} if no row has this id; nothing is written then
     */
    public boolean update(Session session, long id, Map<String, ?> fields) {
        checkWritable(fields);
        Map<String, Object> values = SqlValues.normalize(fields);
        Long actor = session.principalId();
        if (table.isWritable(UPDATED_AT))
            values.put(UPDATED_AT, Timestamps.now(clock));
        if (actor != null)
            fillIfAbsent(values, UPDATED_BY, actor);

        boolean updated = connectionManager.transaction(conn -> {
            Record old = read(id);
            if (old == null) {
                LOG.warn("Update of {}#{} skipped: no such record", table.name(), id);
                return false;
            }
            if (values.isEmpty())
                return true;

            StringJoiner assignments = new StringJoiner(", ");
            List<Object> params = new ArrayList<>(values.size() + 1);
            for (Map.Entry<String, Object> e : values.entrySet()) {
                assignments.add(e.getKey() + " = ?");
                params.add(e.getValue());
            }
            params.add(id);
            connectionManager.execute("UPDATE " + table.name() + " SET " + assignments
                    + " WHERE " + table.primaryKey() + " = ?", params.toArray());
            if (actor != null) {
                auditLog.append(actor, AuditAction.UPDATE, table.name(), id,
                        auditView(old.asMap()), auditView(values));
            }
            return true;
        });
        if (updated)
            LOG.debug("Updated {}#{}", table.name(), id);
        return updated;
    }

    /**
     * Deletes one row.
     *
     * @return {@code false} if no row has this id
     * @throws ConstraintViolationException if other rows still reference it
     */
    public boolean delete(Session session, long id) {
        Long actor = session.principalId();
        boolean deleted = connectionManager.transaction(conn -> {
            Record old = read(id);
            if (old == null) {
                LOG.warn("Delete of {}#{} skipped: no such record", table.name(), id);
                return false;
            }
            connectionManager.execute("DELETE FROM " + table.name() + " WHERE " + table.primaryKey() + " = ?", id);
            if (actor != null) {
                auditLog.append(actor, AuditAction.DELETE, table.name(), id, auditView(old.asMap()), null);
            }
            return true;
        });
        if (deleted)
            LOG.debug("Deleted {}#{}", table.name(), id);
        return deleted;
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /** Returns the row with this primary key, or {@code null}. */
    public Record read(long id) {
        return connectionManager.fetchOne("SELECT * FROM " + table.name() + " WHERE " + table.primaryKey() + " = ?", id);
    }

    public List<Record> find(Map<String, ?> criteria) {
        return find(criteria, null, null, null);
    }

    /**
     * Returns the rows matching every criterion.
     *
     * <p>
     * Criterion values: {@code null} matches SQL {@code NULL}, a
     * {@link Collection} matches any of its elements (an empty one matches
     * nothing), anything else matches by equality. {@code null} or empty
     * criteria match all rows.
     *
     * @param sort   ordering, {@code null} for store order
     * @param limit  maximum number of rows, {@code null} for no limit
     * @param offset rows to skip, {@code null} for none
     * @throws IllegalArgumentException on unknown columns, a column outside
     *                                  the sortable allow-list or negative
     *                                  paging values
     */
    public List<Record> find(Map<String, ?> criteria, Sort sort, Integer limit, Integer offset) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table.name())
                .append(where(criteria, params, true));

        if (sort != null) {
            if (!table.isSortable(sort.column()))
                throw new IllegalArgumentException("Cannot sort " + table.name() + " by '" + sort.column() + "'");
            sql.append(" ORDER BY ").append(sort.column()).append(' ').append(sort.direction().name());
        }
        if (limit != null && limit < 0)
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        if (offset != null && offset < 0)
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        if (limit != null || offset != null) {
            sql.append(" LIMIT ?");
            params.add(limit == null ? -1 : limit);
            if (offset != null) {
                sql.append(" OFFSET ?");
                params.add(offset);
            }
        }
        return connectionManager.fetchAll(sql.toString(), params.toArray());
    }

    /**
     * Counts matching rows. Criteria as {@link #find}, but without
     * collections.
     */
    public long count(Map<String, ?> criteria) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) AS total FROM " + table.name() + where(criteria, params, false);
        return connectionManager.fetchOne(sql, params.toArray()).getLong("total");
    }

    public boolean exists(Map<String, ?> criteria) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT 1 FROM " + table.name() + where(criteria, params, false) + " LIMIT 1";
        return connectionManager.fetchOne(sql, params.toArray()) != null;
    }

    // ===== Helpers =====

    private String where(Map<String, ?> criteria, List<Object> params, boolean allowCollections) {
        if (criteria == null || criteria.isEmpty())
            return "";
        StringJoiner clauses = new StringJoiner(" AND ", " WHERE ", "");
        for (Map.Entry<String, ?> e : criteria.entrySet()) {
            String column = e.getKey();
            if (!table.isQueryable(column))
                throw new IllegalArgumentException("Unknown column '" + column + "' for " + table.name());
            Object value = e.getValue();
            if (value == null) {
                clauses.add(column + " IS NULL");
            } else if (value instanceof Collection<?> values) {
                if (!allowCollections)
                    throw new IllegalArgumentException("Membership criteria are not supported here: " + column);
                if (values.isEmpty()) {
                    clauses.add("0 = 1");
                } else {
                    StringJoiner marks = new StringJoiner(", ", column + " IN (", ")");
                    for (Object v : values) {
                        marks.add("?");
                        params.add(v);
                    }
                    clauses.add(marks.toString());
                }
            } else {
                clauses.add(column + " = ?");
                params.add(value);
            }
        }
        return clauses.toString();
    }

    private void checkWritable(Map<String, ?> fields) {
        for (String column : fields.keySet()) {
            if (!table.isWritable(column))
                throw new IllegalArgumentException("Column '" + column + "' is not writable in " + table.name());
        }
    }

    private Map<String, Object> auditView(Map<String, Object> values) {
        Map<String, Object> view = new LinkedHashMap<>(values);
        for (Map.Entry<String, Object> e : view.entrySet()) {
            if (table.isRedacted(e.getKey()) && e.getValue() != null)
                e.setValue(REDACTED);
        }
        return view;
    }

    private void fillIfAbsent(Map<String, Object> values, String column, Object value) {
        if (table.isWritable(column) && !values.containsKey(column))
            values.put(column, value);
    }
}
