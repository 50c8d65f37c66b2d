package de.bsommerfeld.assetledger.core.session;

import java.util.Set;

/**
 * An authenticated user account together with the capability flags of its
 * role, as read at login time.
 */
public record Principal(long id, String username, String fullName, long roleId, String roleName,
        Set<Permission> permissions) {

    public Principal {
        permissions = Set.copyOf(permissions);
    }

    public boolean has(Permission permission) {
        return permissions.contains(permission);
    }
}
