package de.bsommerfeld.assetledger.core.session;

/**
 * Capability flags carried by a role. Each constant knows the {@code roles}
 * column it is stored in.
 */
public enum Permission {

    READ("can_read"),
    WRITE("can_write"),
    DELETE("can_delete"),
    APPROVE("can_approve"),
    ADMIN("can_admin");

    private final String column;

    Permission(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
