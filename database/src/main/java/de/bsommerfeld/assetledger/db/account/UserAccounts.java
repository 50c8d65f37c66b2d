package de.bsommerfeld.assetledger.db.account;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.core.security.PasswordHasher;
import de.bsommerfeld.assetledger.core.security.StrengthCheck;
import de.bsommerfeld.assetledger.core.session.Permission;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.Record;
import de.bsommerfeld.assetledger.db.RecordStore;
import de.bsommerfeld.assetledger.db.RecordStores;
import de.bsommerfeld.assetledger.db.SqlLoader;
import de.bsommerfeld.assetledger.db.Tables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * User account management on top of the {@code users} store.
 *
 * <p>
 * Administrative operations require {@link Permission#ADMIN} and throw
 * {@link de.bsommerfeld.assetledger.core.session.AccessDeniedException}
 * without it. Business rule failures (duplicate name, weak password, wrong
 * old password) are logged and reported through the return value. Accounts
 * are deactivated, never deleted, so the audit trail keeps its actors.
 */
@Singleton
public class UserAccounts {

    private static final Logger LOG = LoggerFactory.getLogger(UserAccounts.class);

    private final RecordStore users;
    private final ConnectionManager connectionManager;
    private final PasswordHasher passwordHasher;

    @Inject
    public UserAccounts(RecordStores stores, ConnectionManager connectionManager, PasswordHasher passwordHasher) {
        this.users = stores.forTable(Tables.USERS);
        this.connectionManager = connectionManager;
        this.passwordHasher = passwordHasher;
    }

    /**
     * @return the new user's id, or {@code null} if the username is taken or
     *         the password is too weak
     */
    public Long createUser(Session session, String username, String password, String fullName,
            String position, long roleId) {
        session.requirePermission(Permission.ADMIN);
        if (users.exists(Map.of("username", username))) {
            LOG.warn("User {} already exists", username);
            return null;
        }
        StrengthCheck strength = passwordHasher.checkStrength(password);
        if (!strength.valid()) {
            LOG.warn("Rejected password for new user {}: {}", username, strength.reason());
            return null;
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("username", username);
        fields.put("password_hash", passwordHasher.hash(password));
        fields.put("full_name", fullName);
        fields.put("position", position);
        fields.put("role_id", roleId);
        fields.put("is_active", true);
        long id = users.create(session, fields);
        LOG.info("Created user {} (ID: {})", username, id);
        return id;
    }

    /**
     * Changes a password after verifying the old one. Users may change their
     * own password; changing someone else's requires admin rights.
     *
     * @return {@code false} if the user does not exist, the old password is
     *         wrong or the new one is too weak
     */
    public boolean changePassword(Session session, long userId, String oldPassword, String newPassword) {
        if (!Objects.equals(session.principalId(), userId)) {
            session.requirePermission(Permission.ADMIN);
        }
        Record user = users.read(userId);
        if (user == null) {
            LOG.warn("Password change for unknown user ID: {}", userId);
            return false;
        }
        if (!passwordHasher.verify(oldPassword, user.getString("password_hash"))) {
            LOG.warn("Wrong old password on password change for user ID: {}", userId);
            return false;
        }
        StrengthCheck strength = passwordHasher.checkStrength(newPassword);
        if (!strength.valid()) {
            LOG.warn("Weak new password for user ID {}: {}", userId, strength.reason());
            return false;
        }

        boolean changed = users.update(session, userId, Map.of("password_hash", passwordHasher.hash(newPassword)));
        if (changed)
            LOG.info("Password changed for user ID: {}", userId);
        return changed;
    }

    /**
     * Replaces the password with a generated temporary one.
     *
     * @return the temporary password (shown once, not stored in clear), or
     *         {@code null} if the user does not exist
     */
    public String resetPassword(Session session, long userId) {
        session.requirePermission(Permission.ADMIN);
        String temporary = passwordHasher.generateTemporary();
        if (!users.update(session, userId, Map.of("password_hash", passwordHasher.hash(temporary)))) {
            return null;
        }
        LOG.info("Password reset for user ID: {}", userId);
        return temporary;
    }

    /**
     * @return {@code false} if the user does not exist
     * @throws IllegalArgumentException when trying to deactivate oneself
     */
    public boolean deactivate(Session session, long userId) {
        session.requirePermission(Permission.ADMIN);
        if (Objects.equals(session.principalId(), userId)) {
            throw new IllegalArgumentException("Cannot deactivate the logged in user");
        }
        boolean done = users.update(session, userId, Map.of("is_active", false));
        if (done)
            LOG.info("Deactivated user ID: {}", userId);
        return done;
    }

    public boolean activate(Session session, long userId) {
        session.requirePermission(Permission.ADMIN);
        boolean done = users.update(session, userId, Map.of("is_active", true));
        if (done)
            LOG.info("Activated user ID: {}", userId);
        return done;
    }

    /** Active users with their role name, ordered by username. No hashes. */
    public List<Record> activeUsers() {
        return connectionManager.fetchAll(SqlLoader.load("select-active-users"));
    }

    /** Returns the user row, or {@code null}. Includes the password hash. */
    public Record findByUsername(String username) {
        List<Record> found = users.find(Map.of("username", username), null, 1, null);
        return found.isEmpty() ? null : found.get(0);
    }
}
