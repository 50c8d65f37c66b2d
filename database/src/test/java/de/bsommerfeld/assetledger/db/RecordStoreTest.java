package de.bsommerfeld.assetledger.db;

import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the generic store against the migrated schema.
 */
class RecordStoreTest {

    @TempDir
    Path tempDir;

    private ConnectionManager cm;
    private AuditLog auditLog;
    private RecordStore departments;
    private RecordStore nomenclature;
    private Session admin;

    @BeforeEach
    void setUp() {
        cm = StoreFixture.migratedStore(tempDir);
        auditLog = new AuditLog(cm, StoreFixture.FIXED_CLOCK);
        RecordStores stores = new RecordStores(cm, auditLog, StoreFixture.FIXED_CLOCK);
        departments = stores.forTable(Tables.DEPARTMENTS);
        nomenclature = stores.forTable(Tables.NOMENCLATURE);
        admin = StoreFixture.adminSession();
    }

    @AfterEach
    void tearDown() {
        cm.closeAll();
    }

    // -- Create / Read --

    @Test
    void create_shouldRoundTripFieldsAndAutoFill() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("code", "0112345678");
        fields.put("name", "Field boots");
        fields.put("unit", "pair");
        fields.put("price", new BigDecimal("12.50"));
        fields.put("is_temporary", true);
        fields.put("document_date", LocalDate.of(2024, 2, 29));

        long id = nomenclature.create(admin, fields);
        Record row = nomenclature.read(id);

        assertNotNull(row);
        assertEquals("0112345678", row.getString("code"));
        assertEquals("Field boots", row.getString("name"));
        assertEquals("pair", row.getString("unit"));
        assertEquals(12.5, row.getDouble("price"), 0.0001);
        assertTrue(row.getBoolean("is_temporary"));
        assertEquals("2024-02-29", row.getString("document_date"));
        assertEquals(StoreFixture.FIXED_NOW, row.getString("created_at"));
        assertEquals(StoreFixture.FIXED_NOW, row.getString("updated_at"));
        assertEquals(StoreFixture.ADMIN_ID, row.getLong("created_by"));
        assertNull(row.get("updated_by"));
        assertEquals("01", row.getString("class_code"));
    }

    @Test
    void create_shouldKeepCallerSuppliedAuditColumns() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("code", "AB");
        fields.put("name", "Supply");
        fields.put("created_at", "2020-01-01 00:00:00");
        long id = departments.create(admin, fields);

        assertEquals("2020-01-01 00:00:00", departments.read(id).getString("created_at"));
        assertEquals(3, fields.size(), "caller map must not be modified");
    }

    @Test
    void create_shouldWriteExactlyOneAuditEntry() {
        long id = departments.create(admin, Map.of("code", "AB", "name", "Supply"));

        List<AuditEntry> entries = auditLog.entriesFor("departments", id);
        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals(AuditAction.CREATE, entry.action());
        assertEquals(StoreFixture.ADMIN_ID, entry.actorId());
        assertNull(entry.oldValues());
        assertEquals("Supply", entry.newValues().get("name"));
    }

    @Test
    void create_withoutPrincipalShouldNotAudit() {
        long id = departments.create(new Session(), Map.of("code", "AB", "name", "Supply"));

        assertNotNull(departments.read(id));
        assertNull(departments.read(id).get("created_by"));
        assertEquals(0, auditLog.count());
    }

    @Test
    void create_shouldRejectUnknownAndGeneratedColumns() {
        assertThrows(IllegalArgumentException.class,
                () -> departments.create(admin, Map.of("code", "AB", "name = 1; --", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> nomenclature.create(admin, Map.of("code", "0112345678", "class_code", "99")));
        assertThrows(IllegalArgumentException.class,
                () -> departments.create(admin, Map.of("id", 5, "code", "AB", "name", "x")));
    }

    @Test
    void create_shouldThrowOnUniqueViolation() {
        departments.create(admin, Map.of("code", "AB", "name", "Supply"));
        assertThrows(ConstraintViolationException.class,
                () -> departments.create(admin, Map.of("code", "AB", "name", "Other")));
        assertEquals(1, auditLog.count());
    }

    @Test
    void create_shouldRollBackWhenAuditWriteFails() {
        Session ghost = StoreFixture.sessionWith(999L, Set.of(Permission.WRITE));

        assertThrows(ConstraintViolationException.class,
                () -> departments.create(ghost, Map.of("code", "AB", "name", "Supply")));
        assertEquals(0, departments.count(Map.of()));
        assertEquals(0, auditLog.count());
    }

    @Test
    void read_shouldReturnNullForMissingId() {
        assertNull(departments.read(12345));
    }

    @Test
    void create_withDefaultClockShouldWriteUtcLikeColumnDefaults() {
        TimeZone previous = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("Asia/Tokyo"));
        try {
            AuditLog systemAudit = new AuditLog(cm);
            RecordStore roles = new RecordStores(cm, systemAudit).forTable(Tables.ROLES);
            long id = roles.create(admin, Map.of("name", "Auditor"));

            LocalDateTime seeded = parse(roles.read(StoreFixture.ADMIN_ROLE_ID).getString("created_at"));
            LocalDateTime written = parse(roles.read(id).getString("created_at"));
            LocalDateTime audited = parse(systemAudit.entriesFor("roles", id).get(0).createdAt());

            assertTrue(Duration.between(seeded, written).abs().toMinutes() < 5,
                    "seeded " + seeded + " vs written " + written);
            assertTrue(Duration.between(seeded, audited).abs().toMinutes() < 5,
                    "seeded " + seeded + " vs audited " + audited);
        } finally {
            TimeZone.setDefault(previous);
        }
    }

    private static LocalDateTime parse(String timestamp) {
        return LocalDateTime.parse(timestamp, Timestamps.FORMAT);
    }

    // -- Update / Delete --

    @Test
    void update_shouldChangeFieldsAndAuditDiff() {
        long id = departments.create(admin, Map.of("code", "AB", "name", "Supply"));

        assertTrue(departments.update(admin, id, Map.of("name", "Logistics")));

        Record row = departments.read(id);
        assertEquals("Logistics", row.getString("name"));
        assertEquals(StoreFixture.ADMIN_ID, row.getLong("updated_by"));
        List<AuditEntry> entries = auditLog.entriesFor("departments", id);
        assertEquals(2, entries.size());
        AuditEntry update = entries.get(1);
        assertEquals(AuditAction.UPDATE, update.action());
        assertEquals("Supply", update.oldValues().get("name"));
        assertEquals("Logistics", update.newValues().get("name"));
    }

    @Test
    void update_missingIdShouldReturnFalseWithoutAudit() {
        long before = auditLog.count();
        assertFalse(departments.update(admin, 777, Map.of("name", "Nobody")));
        assertEquals(before, auditLog.count());
    }

    @Test
    void delete_shouldRemoveRowAndAuditOldValues() {
        long id = departments.create(admin, Map.of("code", "AB", "name", "Supply"));

        assertTrue(departments.delete(admin, id));

        assertNull(departments.read(id));
        AuditEntry entry = auditLog.entriesFor("departments", id).get(1);
        assertEquals(AuditAction.DELETE, entry.action());
        assertEquals("AB", entry.oldValues().get("code"));
        assertNull(entry.newValues());
    }

    @Test
    void delete_missingIdShouldReturnFalseWithoutAudit() {
        assertFalse(departments.delete(admin, 777));
        assertEquals(0, auditLog.count());
    }

    @Test
    void delete_referencedRowShouldFailAndKeepRow() {
        long parent = departments.create(admin, Map.of("code", "AA", "name", "Parent"));
        departments.create(admin, Map.of("code", "AB", "name", "Child", "parent_id", parent));

        assertThrows(ConstraintViolationException.class, () -> departments.delete(admin, parent));
        assertNotNull(departments.read(parent));
    }

    // -- Find --

    @Test
    void find_shouldSupportEqualityNullAndMembership() {
        long a = departments.create(admin, Map.of("code", "AA", "name", "Alpha"));
        long b = departments.create(admin, Map.of("code", "BB", "name", "Beta", "parent_id", a));
        departments.create(admin, Map.of("code", "CC", "name", "Gamma", "parent_id", a));

        assertEquals(1, departments.find(Map.of("name", "Beta")).size());

        Map<String, Object> noParent = new HashMap<>();
        noParent.put("parent_id", null);
        assertEquals(List.of(a), ids(departments.find(noParent)));

        assertEquals(List.of(a, b), ids(departments.find(Map.of("code", List.of("AA", "BB")), Sort.asc("code"), null, null)));
        assertTrue(departments.find(Map.of("code", List.of())).isEmpty());
        assertEquals(3, departments.find(null).size());
    }

    @Test
    void find_criteriaShouldBeConjunctive() {
        long a = departments.create(admin, Map.of("code", "AA", "name", "Alpha"));
        departments.create(admin, Map.of("code", "BB", "name", "Alpha", "parent_id", a));

        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put("name", "Alpha");
        criteria.put("parent_id", null);
        assertEquals(List.of(a), ids(departments.find(criteria)));
    }

    @Test
    void find_shouldSortAndPage() {
        for (String code : List.of("CC", "AA", "DD", "BB")) {
            departments.create(admin, Map.of("code", code, "name", "Dept " + code));
        }

        List<String> codes = codes(departments.find(Map.of(), Sort.desc("code"), 2, 1));
        assertEquals(List.of("CC", "BB"), codes);

        assertEquals(List.of("CC", "DD"), codes(departments.find(Map.of(), Sort.asc("code"), null, 2)));
        assertEquals(List.of("AA"), codes(departments.find(Map.of(), Sort.asc("code"), 1, null)));
    }

    @Test
    void find_shouldRejectSortOutsideAllowList() {
        assertThrows(IllegalArgumentException.class,
                () -> departments.find(Map.of(), Sort.asc("head_id"), null, null));
        assertThrows(IllegalArgumentException.class,
                () -> departments.find(Map.of(), Sort.asc("name; DROP TABLE users"), null, null));
    }

    @Test
    void find_shouldRejectUnknownCriteriaColumnsAndNegativePaging() {
        assertThrows(IllegalArgumentException.class, () -> departments.find(Map.of("1=1 OR name", "x")));
        assertThrows(IllegalArgumentException.class, () -> departments.find(Map.of(), null, -1, null));
        assertThrows(IllegalArgumentException.class, () -> departments.find(Map.of(), null, null, -5));
    }

    @Test
    void find_shouldFilterByGeneratedColumns() {
        nomenclature.create(admin, Map.of("code", "0112345678", "name", "Boots", "unit", "pair"));
        nomenclature.create(admin, Map.of("code", "0212345678", "name", "Rope", "unit", "m"));

        assertEquals(1, nomenclature.find(Map.of("class_code", "02")).size());
    }

    @Test
    void countAndExists_shouldUseCriteria() {
        departments.create(admin, Map.of("code", "AA", "name", "Alpha"));
        departments.create(admin, Map.of("code", "BB", "name", "Beta"));

        assertEquals(2, departments.count(Map.of()));
        assertEquals(1, departments.count(Map.of("name", "Beta")));
        assertTrue(departments.exists(Map.of("code", "AA")));
        assertFalse(departments.exists(Map.of("code", "ZZ")));
        assertThrows(IllegalArgumentException.class, () -> departments.count(Map.of("code", List.of("AA"))));
    }

    // -- Concurrency --

    @Test
    void concurrentWriters_shouldNotLoseWrites() throws Exception {
        int perThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<List<Long>>> results = new ArrayList<>();
        try {
            for (int t = 0; t < 2; t++) {
                String prefix = String.valueOf((char) ('a' + t));
                Callable<List<Long>> writer = () -> {
                    cm.open();
                    try {
                        start.await();
                        List<Long> ids = new ArrayList<>();
                        for (int i = 0; i < perThread; i++) {
                            ids.add(departments.create(admin, Map.of("code", prefix + i, "name", "Dept")));
                        }
                        return ids;
                    } finally {
                        cm.close();
                    }
                };
                results.add(executor.submit(writer));
            }
            start.countDown();

            Set<Long> allIds = new HashSet<>();
            for (Future<List<Long>> f : results) {
                allIds.addAll(f.get());
            }
            assertEquals(2 * perThread, allIds.size());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(2 * perThread, departments.count(Map.of()));
        assertEquals(2 * perThread, auditLog.count());
    }

    private static List<Long> ids(List<Record> rows) {
        return rows.stream().map(r -> r.getLong("id")).collect(Collectors.toList());
    }

    private static List<String> codes(List<Record> rows) {
        return rows.stream().map(r -> r.getString("code")).collect(Collectors.toList());
    }
}
