package de.bsommerfeld.assetledger.db;

public enum AuditAction {
    CREATE, UPDATE, DELETE
}
