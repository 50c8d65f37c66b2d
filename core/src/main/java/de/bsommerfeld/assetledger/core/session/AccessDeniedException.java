package de.bsommerfeld.assetledger.core.session;

/**
 * Thrown when the current session lacks the permission an operation requires.
 */
public class AccessDeniedException extends RuntimeException {

    private final Permission permission;

    public AccessDeniedException(Permission permission, String message) {
        super(message);
        this.permission = permission;
    }

    public Permission getPermission() {
        return permission;
    }
}
