package de.bsommerfeld.assetledger.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only trail of data mutations.
 *
 * <p>
 * {@link #append} runs on the calling thread's connection and therefore joins
 * the caller's transaction: {@link RecordStore} writes the data change and
 * its entry together, so one never exists without the other. Value maps are
 * stored as JSON text. Numbers, strings, booleans and {@code null} keep their
 * JSON type; anything else is stored as its string form.
 *
 * <p>
 * There is deliberately no API to change or remove entries.
 */
@Singleton
public class AuditLog {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLog.class);
    private static final TypeReference<LinkedHashMap<String, Object>> VALUES_TYPE = new TypeReference<>() {
    };

    private final ConnectionManager connectionManager;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    @Inject
    public AuditLog(ConnectionManager connectionManager) {
        this(connectionManager, Clock.systemUTC());
    }

    public AuditLog(ConnectionManager connectionManager, Clock clock) {
        this.connectionManager = connectionManager;
        this.clock = clock;
    }

    // =====================================================================
    // Write
    // =====================================================================

    /**
     * Records one mutation.
     *
     * @param actorId   the acting principal, must exist in {@code users}
     * @param recordId  primary key of the affected row, may be {@code null}
     * @param oldValues row state before the change, {@code null} for creates
     * @param newValues row state after the change, {@code null} for deletes
     * @return the id of the new entry
     */
    public long append(long actorId, AuditAction action, String tableName, Long recordId,
            Map<String, ?> oldValues, Map<String, ?> newValues) {
        long id = connectionManager.insert(SqlLoader.load("insert-audit-entry"),
                actorId, action.name(), tableName, recordId,
                encode(oldValues), encode(newValues), Timestamps.now(clock));
        LOG.debug("Audit {} {}#{} by user {}", action, tableName, recordId, actorId);
        return id;
    }

    // =====================================================================
    // Read
    // =====================================================================

    /** Entries for one row, oldest first. */
    public List<AuditEntry> entriesFor(String tableName, long recordId) {
        return toEntries(connectionManager.fetchAll(SqlLoader.load("select-audit-for-record"), tableName, recordId));
    }

    /** Entries written by one principal, oldest first. */
    public List<AuditEntry> entriesBy(long actorId) {
        return toEntries(connectionManager.fetchAll(SqlLoader.load("select-audit-by-actor"), actorId));
    }

    /** The newest {@code limit} entries, newest first. */
    public List<AuditEntry> recent(int limit) {
        if (limit <= 0)
            return List.of();
        return toEntries(connectionManager.fetchAll(SqlLoader.load("select-audit-recent"), limit));
    }

    public long count() {
        return connectionManager.fetchOne(SqlLoader.load("count-audit")).getLong("total");
    }

    // =====================================================================
    // JSON
    // =====================================================================

    String encode(Map<String, ?> values) {
        if (values == null)
            return null;
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            plain.put(e.getKey(), plain(SqlValues.normalize(e.getValue())));
        }
        try {
            return objectMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize audit values {}", plain.keySet(), e);
            throw new PersistenceException("Failed to serialize audit values", e);
        }
    }

    private static Object plain(Object value) {
        if (value == null || value instanceof Number || value instanceof String || value instanceof Boolean)
            return value;
        if (value instanceof byte[])
            return value;
        return value.toString();
    }

    /**
     * Parses a stored value map. Returns {@code null} for {@code null} input.
     *
     * @throws PersistenceException if the text is not a JSON object
     */
    public Map<String, Object> decode(String json) {
        if (json == null)
            return null;
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(json, VALUES_TYPE));
        } catch (JsonProcessingException e) {
            LOG.error("Corrupt audit values: {}", json, e);
            throw new PersistenceException("Corrupt audit values", e);
        }
    }

    private List<AuditEntry> toEntries(List<Record> rows) {
        List<AuditEntry> entries = new ArrayList<>(rows.size());
        for (Record row : rows) {
            entries.add(new AuditEntry(
                    row.getLong("id"),
                    row.getLong("user_id"),
                    AuditAction.valueOf(row.getString("action")),
                    row.getString("table_name"),
                    row.getLong("record_id"),
                    decode(row.getString("old_values")),
                    decode(row.getString("new_values")),
                    row.getString("created_at")));
        }
        return entries;
    }
}
