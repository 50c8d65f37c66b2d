package de.bsommerfeld.assetledger.core.session;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * The login state of this application instance.
 *
 * <p>
 * One instance exists per process (bound as a Guice singleton) and is handed
 * explicitly to every operation that needs an acting principal or a
 * permission check. Nothing reaches it through a static field.
 *
 * <h3>Permission snapshot</h3>
 * The capability flags are copied from the principal's role when the session
 * begins. Editing the role afterwards does not change an active session; the
 * new flags apply from the next login on.
 *
 * <h3>Admin bypass</h3>
 * {@link Permission#ADMIN} satisfies every permission check.
 *
 * <h3>Threading</h3>
 * Not thread-safe. The session belongs to the coordinating (UI) thread;
 * background workers must not log in or out.
 */
@Singleton
public class Session {

    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    private Long principalId;
    private String username;
    private Long roleId;
    private String roleName;
    private Set<Permission> permissions = EnumSet.noneOf(Permission.class);
    private Instant loginTime;

    /** Creates an unauthenticated session. */
    public Session() {
    }

    /**
     * Creates a session that is already authenticated as {@code principal}.
     * Used by background jobs and tests that act on behalf of a known user.
     */
    public static Session of(Principal principal) {
        Session session = new Session();
        session.begin(principal);
        return session;
    }

    /**
     * Starts the session for {@code principal}, replacing any previous login.
     */
    public void begin(Principal principal) {
        this.principalId = principal.id();
        this.username = principal.username();
        this.roleId = principal.roleId();
        this.roleName = principal.roleName();
        this.permissions = principal.permissions().isEmpty()
                ? EnumSet.noneOf(Permission.class)
                : EnumSet.copyOf(principal.permissions());
        this.loginTime = Instant.now();
        LOG.debug("Session started for {} (role {})", username, roleName);
    }

    /** Forgets the logged-in principal. Safe to call when nobody is logged in. */
    public void clear() {
        if (principalId != null) {
            LOG.debug("Session cleared for {}", username);
        }
        principalId = null;
        username = null;
        roleId = null;
        roleName = null;
        permissions = EnumSet.noneOf(Permission.class);
        loginTime = null;
    }

    public boolean isAuthenticated() {
        return principalId != null;
    }

    /**
     * Returns {@code true} if the session holds {@code permission} or the
     * admin flag.
     */
    public boolean hasPermission(Permission permission) {
        return permissions.contains(Permission.ADMIN) || permissions.contains(permission);
    }

    /**
     * @throws AccessDeniedException if not authenticated or the permission is
     *                               missing
     */
    public void requirePermission(Permission permission) {
        if (!isAuthenticated()) {
            throw new AccessDeniedException(permission, "Not authenticated");
        }
        if (!hasPermission(permission)) {
            throw new AccessDeniedException(permission,
                    "User '" + username + "' lacks permission " + permission);
        }
    }

    /** The acting principal's id, or {@code null} when not authenticated. */
    public Long principalId() {
        return principalId;
    }

    public String username() {
        return username;
    }

    public Long roleId() {
        return roleId;
    }

    public String roleName() {
        return roleName;
    }

    public Set<Permission> permissions() {
        return permissions.isEmpty() ? Set.of() : Set.copyOf(permissions);
    }

    public Instant loginTime() {
        return loginTime;
    }
}
