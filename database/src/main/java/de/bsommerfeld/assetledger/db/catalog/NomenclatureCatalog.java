package de.bsommerfeld.assetledger.db.catalog;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.core.domain.NomenclatureCode;
import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.Record;
import de.bsommerfeld.assetledger.db.RecordStore;
import de.bsommerfeld.assetledger.db.RecordStores;
import de.bsommerfeld.assetledger.db.Sort;
import de.bsommerfeld.assetledger.db.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The nomenclature reference book.
 *
 * <p>
 * Codes are validated and normalized to their 10-digit form before they
 * reach the store. Class, group, subgroup and item number are derived by the
 * table itself and can be queried but not written. Entries are retired
 * rather than deleted, since stock records keep referring to them.
 */
@Singleton
public class NomenclatureCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(NomenclatureCatalog.class);
    private static final Sort BY_CODE = Sort.asc("code");

    private final RecordStore nomenclature;

    @Inject
    public NomenclatureCatalog(RecordStores stores) {
        this.nomenclature = stores.forTable(Tables.NOMENCLATURE);
    }

    /**
     * Adds an entry. {@code fields} must contain a {@code code}.
     *
     * @return the new entry's id
     * @throws IllegalArgumentException if the code is missing or malformed
     */
    public long register(Session session, Map<String, ?> fields) {
        session.requirePermission(Permission.WRITE);
        Object code = fields.get("code");
        if (!(code instanceof String text)) {
            throw new IllegalArgumentException("Nomenclature entry needs a code");
        }
        Map<String, Object> values = new LinkedHashMap<>(fields);
        values.put("code", NomenclatureCode.parse(text).value());
        long id = nomenclature.create(session, values);
        LOG.info("Registered nomenclature {} (ID: {})", values.get("code"), id);
        return id;
    }

    /**
     * Changes an entry. A {@code code} in {@code fields} is validated like on
     * {@link #register}.
     *
     * @return {@code false} if there is no such entry
     */
    public boolean update(Session session, long id, Map<String, ?> fields) {
        session.requirePermission(Permission.WRITE);
        Map<String, Object> values = new LinkedHashMap<>(fields);
        if (values.containsKey("code")) {
            Object code = values.get("code");
            if (!(code instanceof String text))
                throw new IllegalArgumentException("Nomenclature code must be text");
            values.put("code", NomenclatureCode.parse(text).value());
        }
        return nomenclature.update(session, id, values);
    }

    /**
     * Marks an entry inactive. It stays readable by id and code.
     *
     * @return {@code false} if there is no such entry
     */
    public boolean retire(Session session, long id) {
        session.requirePermission(Permission.DELETE);
        boolean retired = nomenclature.update(session, id, Map.of("is_active", false));
        if (retired)
            LOG.info("Retired nomenclature ID: {}", id);
        return retired;
    }

    public Record read(long id) {
        return nomenclature.read(id);
    }

    /** Looks up an entry by code in any accepted spelling, or {@code null}. */
    public Record findByCode(String code) {
        List<Record> found = nomenclature.find(Map.of("code", NomenclatureCode.parse(code).value()), null, 1, null);
        return found.isEmpty() ? null : found.get(0);
    }

    /** Entries of one class (first two digits), ordered by code. */
    public List<Record> findByClass(String classCode) {
        return nomenclature.find(Map.of("class_code", classCode), BY_CODE, null, null);
    }

    /** Entries of one group within a class, ordered by code. */
    public List<Record> findByGroup(String classCode, String groupCode) {
        Map<String, Object> criteria = new LinkedHashMap<>();
        criteria.put("class_code", classCode);
        criteria.put("group_code", groupCode);
        return nomenclature.find(criteria, BY_CODE, null, null);
    }

    /** Entries not retired, ordered by code. */
    public List<Record> findActive() {
        return nomenclature.find(Map.of("is_active", true), BY_CODE, null, null);
    }

    public long countActive() {
        return nomenclature.count(Map.of("is_active", true));
    }
}
