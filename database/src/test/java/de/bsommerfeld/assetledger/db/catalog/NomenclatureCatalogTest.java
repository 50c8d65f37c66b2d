package de.bsommerfeld.assetledger.db.catalog;

import de.bsommerfeld.assetledger.core.session.AccessDeniedException;
import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.AuditLog;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.ConstraintViolationException;
import de.bsommerfeld.assetledger.db.Record;
import de.bsommerfeld.assetledger.db.RecordStores;
import de.bsommerfeld.assetledger.db.StoreFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NomenclatureCatalogTest {

    @TempDir
    Path tempDir;

    private ConnectionManager cm;
    private NomenclatureCatalog catalog;
    private Session admin;

    @BeforeEach
    void setUp() {
        cm = StoreFixture.migratedStore(tempDir);
        catalog = new NomenclatureCatalog(new RecordStores(cm, new AuditLog(cm)));
        admin = StoreFixture.adminSession();
    }

    @AfterEach
    void tearDown() {
        cm.closeAll();
    }

    @Test
    void register_shouldNormalizeCodeAndDeriveClassification() {
        long id = catalog.register(admin, Map.of("code", "01-123-45-678", "name", "Field boots", "unit", "pair"));

        Record row = catalog.read(id);
        assertEquals("0112345678", row.getString("code"));
        assertEquals("01", row.getString("class_code"));
        assertEquals("123", row.getString("group_code"));
        assertEquals("45", row.getString("subgroup_code"));
        assertEquals("678", row.getString("item_number"));
        assertTrue(row.getBoolean("is_active"));
    }

    @Test
    void register_shouldRejectMalformedOrMissingCode() {
        assertThrows(IllegalArgumentException.class,
                () -> catalog.register(admin, Map.of("code", "01ABC", "name", "X", "unit", "pc")));
        assertThrows(IllegalArgumentException.class,
                () -> catalog.register(admin, Map.of("name", "X", "unit", "pc")));
    }

    @Test
    void register_shouldRejectDuplicateCode() {
        catalog.register(admin, Map.of("code", "0112345678", "name", "A", "unit", "pc"));
        assertThrows(ConstraintViolationException.class,
                () -> catalog.register(admin, Map.of("code", "01 123 45 678", "name", "B", "unit", "pc")));
    }

    @Test
    void register_shouldRequireWritePermission() {
        Session observer = StoreFixture.sessionWith(StoreFixture.ADMIN_ID, Set.of(Permission.READ));
        assertThrows(AccessDeniedException.class,
                () -> catalog.register(observer, Map.of("code", "0112345678", "name", "A", "unit", "pc")));
    }

    @Test
    void findByClassAndGroup_shouldUseDerivedColumns() {
        catalog.register(admin, Map.of("code", "0212300001", "name", "C", "unit", "pc"));
        catalog.register(admin, Map.of("code", "0112300002", "name", "B", "unit", "pc"));
        catalog.register(admin, Map.of("code", "0112300001", "name", "A", "unit", "pc"));
        catalog.register(admin, Map.of("code", "0199900001", "name", "D", "unit", "pc"));

        assertEquals(List.of("0112300001", "0112300002", "0199900001"), codes(catalog.findByClass("01")));
        assertEquals(List.of("0112300001", "0112300002"), codes(catalog.findByGroup("01", "123")));
        assertEquals("0212300001", catalog.findByCode("02 123 00 001").getString("code"));
        assertNull(catalog.findByCode("0000000000"));
    }

    @Test
    void retire_shouldHideFromActiveButKeepRow() {
        long keep = catalog.register(admin, Map.of("code", "0112300001", "name", "A", "unit", "pc"));
        long gone = catalog.register(admin, Map.of("code", "0112300002", "name", "B", "unit", "pc"));

        assertTrue(catalog.retire(admin, gone));

        assertEquals(List.of(keep), catalog.findActive().stream().map(r -> r.getLong("id")).collect(Collectors.toList()));
        assertEquals(1, catalog.countActive());
        assertNotNull(catalog.read(gone));
        assertFalse(catalog.retire(admin, 999L));
    }

    @Test
    void retire_shouldRequireDeletePermission() {
        long id = catalog.register(admin, Map.of("code", "0112300001", "name", "A", "unit", "pc"));
        Session operator = StoreFixture.sessionWith(StoreFixture.ADMIN_ID, Set.of(Permission.READ, Permission.WRITE));
        assertThrows(AccessDeniedException.class, () -> catalog.retire(operator, id));
    }

    @Test
    void update_shouldRevalidateCode() {
        long id = catalog.register(admin, Map.of("code", "0112300001", "name", "A", "unit", "pc"));

        assertTrue(catalog.update(admin, id, Map.of("code", "03-456-78-901")));
        assertEquals("03", catalog.read(id).getString("class_code"));
        assertThrows(IllegalArgumentException.class, () -> catalog.update(admin, id, Map.of("code", "bad")));
    }

    private static List<String> codes(List<Record> rows) {
        return rows.stream().map(r -> r.getString("code")).collect(Collectors.toList());
    }
}
