package de.bsommerfeld.assetledger.db.account;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.Record;
import de.bsommerfeld.assetledger.db.RecordStore;
import de.bsommerfeld.assetledger.db.RecordStores;
import de.bsommerfeld.assetledger.db.Sort;
import de.bsommerfeld.assetledger.db.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Roles and their capability flags.
 *
 * <p>
 * Changing a role does not touch sessions that are already logged in; their
 * flags were copied at login.
 */
@Singleton
public class RoleDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(RoleDirectory.class);

    private final RecordStore roles;

    @Inject
    public RoleDirectory(RecordStores stores) {
        this.roles = stores.forTable(Tables.ROLES);
    }

    /**
     * Reads the {@code can_*} flags of a row that carries them, such as a
     * {@code roles} row or the login join.
     */
    public static Set<Permission> permissionsFrom(Record row) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        for (Permission p : Permission.values()) {
            if (row.getBoolean(p.column()))
                permissions.add(p);
        }
        return permissions;
    }

    /** Flags of the role, or an empty set if the role does not exist. */
    public Set<Permission> permissionsOf(long roleId) {
        Record role = roles.read(roleId);
        if (role == null) {
            LOG.warn("Role {} not found", roleId);
            return Set.of();
        }
        return permissionsFrom(role);
    }

    public Record findByName(String name) {
        List<Record> found = roles.find(Map.of("name", name), null, 1, null);
        return found.isEmpty() ? null : found.get(0);
    }

    /** All roles ordered by name. */
    public List<Record> allRoles() {
        return roles.find(Map.of(), Sort.asc("name"), null, null);
    }

    /**
     * @return the new role's id, or {@code null} if the name is taken
     * @throws de.bsommerfeld.assetledger.core.session.AccessDeniedException
     *         without {@link Permission#ADMIN}
     */
    public Long createRole(Session session, String name, String description, Set<Permission> permissions) {
        session.requirePermission(Permission.ADMIN);
        if (roles.exists(Map.of("name", name))) {
            LOG.warn("Role '{}' already exists", name);
            return null;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", name);
        fields.put("description", description);
        fields.putAll(flags(permissions));
        long id = roles.create(session, fields);
        LOG.info("Created role '{}' (ID: {}) with {}", name, id, permissions);
        return id;
    }

    /**
     * Replaces all flags of a role. Active sessions keep their old flags
     * until their next login.
     *
     * @return {@code false} if the role does not exist
     */
    public boolean updatePermissions(Session session, long roleId, Set<Permission> permissions) {
        session.requirePermission(Permission.ADMIN);
        boolean updated = roles.update(session, roleId, flags(permissions));
        if (updated)
            LOG.info("Permissions of role {} set to {}", roleId, permissions);
        return updated;
    }

    private static Map<String, Object> flags(Set<Permission> permissions) {
        Map<String, Object> flags = new LinkedHashMap<>();
        for (Permission p : Permission.values()) {
            flags.put(p.column(), permissions.contains(p));
        }
        return flags;
    }
}
