package de.bsommerfeld.assetledger.db.account;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.assetledger.core.event.ApplicationEventBus;
import de.bsommerfeld.assetledger.core.event.SessionEvents;
import de.bsommerfeld.assetledger.core.security.PasswordHasher;
import de.bsommerfeld.assetledger.core.session.Principal;
import de.bsommerfeld.assetledger.core.session.Session;
import de.bsommerfeld.assetledger.db.ConnectionManager;
import de.bsommerfeld.assetledger.db.Record;
import de.bsommerfeld.assetledger.db.SqlLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies credentials and opens or closes the {@link Session}.
 *
 * <p>
 * Unknown user, inactive user and wrong password all yield {@code null} so a
 * caller cannot tell them apart. Only the log says which one it was, and it
 * never contains the password.
 */
@Singleton
public class Authenticator {

    private static final Logger LOG = LoggerFactory.getLogger(Authenticator.class);

    private final ConnectionManager connectionManager;
    private final PasswordHasher passwordHasher;
    private final ApplicationEventBus eventBus;

    @Inject
    public Authenticator(ConnectionManager connectionManager, PasswordHasher passwordHasher,
            ApplicationEventBus eventBus) {
        this.connectionManager = connectionManager;
        this.passwordHasher = passwordHasher;
        this.eventBus = eventBus;
    }

    /**
     * @return the principal with its role's flags, or {@code null} if the
     *         credentials do not match an active user
     */
    public Principal authenticate(String username, String password) {
        if (username == null || username.isBlank() || password == null) {
            LOG.warn("Login attempt with empty credentials");
            return null;
        }
        Record row = connectionManager.fetchOne(SqlLoader.load("select-principal-for-login"), username);
        if (row == null) {
            LOG.warn("Login attempt for unknown or inactive user: {}", username);
            return null;
        }
        if (!passwordHasher.verify(password, row.getString("password_hash"))) {
            LOG.warn("Wrong password for user: {}", username);
            return null;
        }

        Principal principal = new Principal(
                row.getLong("id"),
                row.getString("username"),
                row.getString("full_name"),
                row.getLong("role_id"),
                row.getString("role_name"),
                RoleDirectory.permissionsFrom(row));
        LOG.info("User '{}' authenticated (role {})", principal.username(), principal.roleName());
        return principal;
    }

    /**
     * Authenticates and, on success, begins {@code session}.
     *
     * @return {@code true} if the session is now logged in as {@code username}
     */
    public boolean login(Session session, String username, String password) {
        Principal principal = authenticate(username, password);
        if (principal == null) {
            eventBus.post(new SessionEvents.LoginFailedEvent(username));
            return false;
        }
        if (session.isAuthenticated()) {
            logout(session);
        }
        session.begin(principal);
        eventBus.post(new SessionEvents.LoggedInEvent(principal.id(), principal.username(),
                principal.roleName(), session.loginTime()));
        return true;
    }

    /** Ends the session. Does nothing if nobody is logged in. */
    public void logout(Session session) {
        if (!session.isAuthenticated())
            return;
        long id = session.principalId();
        String username = session.username();
        session.clear();
        LOG.info("User '{}' logged out", username);
        eventBus.post(new SessionEvents.LoggedOutEvent(id, username));
    }
}
