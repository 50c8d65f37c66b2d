package de.bsommerfeld.assetledger.db;

/**
 * Descriptors of the business tables created by the initial schema migration.
 */
public final class Tables {

    public static final TableDescriptor ROLES = TableDescriptor.builder("roles")
            .columns("name", "description", "can_read", "can_write", "can_delete", "can_approve", "can_admin")
            .auditColumns()
            .sortable("name", "created_at")
            .build();

    public static final TableDescriptor USERS = TableDescriptor.builder("users")
            .columns("username", "password_hash", "full_name", "position", "is_active", "role_id")
            .auditColumns()
            .redacted("password_hash")
            .sortable("username", "full_name", "created_at")
            .build();

    public static final TableDescriptor DEPARTMENTS = TableDescriptor.builder("departments")
            .columns("code", "name", "parent_id", "head_id")
            .auditColumns()
            .sortable("code", "name", "created_at")
            .build();

    public static final TableDescriptor OFFICIALS = TableDescriptor.builder("officials")
            .columns("military_unit", "department_id", "position", "rank", "full_name", "is_responsible")
            .auditColumns()
            .sortable("full_name", "position", "department_id", "created_at")
            .build();

    public static final TableDescriptor MATERIAL_GROUPS = TableDescriptor.builder("material_groups")
            .columns("code", "name", "department_id")
            .auditColumns()
            .sortable("code", "name", "created_at")
            .build();

    public static final TableDescriptor NOMENCLATURE = TableDescriptor.builder("nomenclature")
            .columns("code", "okp_code", "name", "unit", "price", "weight_unit", "weight_total",
                    "department_id", "is_active", "is_temporary", "base_document", "document_date")
            .auditColumns()
            .generated("class_code", "group_code", "subgroup_code", "item_number")
            .sortable("code", "name", "price", "class_code", "group_code", "created_at", "updated_at")
            .build();

    public static final TableDescriptor CATEGORIES = TableDescriptor.builder("categories")
            .columns("code", "name", "description")
            .auditColumns()
            .sortable("code", "name")
            .build();

    private Tables() {
    }
}
