package de.bsommerfeld.assetledger.db;

import java.util.Map;

/**
 * One immutable row of the audit trail. {@code oldValues} is {@code null} for
 * {@link AuditAction#CREATE}, {@code newValues} for {@link AuditAction#DELETE}.
 */
public record AuditEntry(
        long id,
        long actorId,
        AuditAction action,
        String tableName,
        Long recordId,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        String createdAt) {
}
