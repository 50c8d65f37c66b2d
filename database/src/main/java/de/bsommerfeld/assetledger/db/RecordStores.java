package de.bsommerfeld.assetledger.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link RecordStore} per table.
 */
@Singleton
public class RecordStores {

    private final ConnectionManager connectionManager;
    private final AuditLog auditLog;
    private final Clock clock;
    private final Map<String, RecordStore> stores = new ConcurrentHashMap<>();

    @Inject
    public RecordStores(ConnectionManager connectionManager, AuditLog auditLog) {
        this(connectionManager, auditLog, Clock.systemUTC());
    }

    public RecordStores(ConnectionManager connectionManager, AuditLog auditLog, Clock clock) {
        this.connectionManager = connectionManager;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    public RecordStore forTable(TableDescriptor table) {
        return stores.computeIfAbsent(table.name(),
                name -> new RecordStore(connectionManager, auditLog, table, clock));
    }
}
