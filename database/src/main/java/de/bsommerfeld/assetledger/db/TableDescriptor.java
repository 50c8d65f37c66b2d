package de.bsommerfeld.assetledger.db;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Describes one table to a {@link RecordStore}: its name, primary key, the
 * columns callers may write, the columns the store computes itself and the
 * columns results may be ordered by.
 *
 * <p>
 * Every identifier is checked against {@code [a-z_][a-z0-9_]*} when the
 * descriptor is built, so the store can interpolate them into SQL. Values are
 * always bound.
 */
public final class TableDescriptor {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final String name;
    private final String primaryKey;
    private final Set<String> columns;
    private final Set<String> generatedColumns;
    private final Set<String> sortableColumns;
    private final Set<String> redactedColumns;

    private TableDescriptor(Builder builder) {
        this.name = builder.name;
        this.primaryKey = builder.primaryKey;
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.columns));
        this.generatedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.generatedColumns));
        this.sortableColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.sortableColumns));
        this.redactedColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.redactedColumns));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String primaryKey() {
        return primaryKey;
    }

    /** Columns a caller may supply to create and update, primary key excluded. */
    public Set<String> columns() {
        return columns;
    }

    /** Columns computed by the store; readable and filterable, never writable. */
    public Set<String> generatedColumns() {
        return generatedColumns;
    }

    public Set<String> sortableColumns() {
        return sortableColumns;
    }

    /** Whether values of {@code column} are masked in audit entries. */
    public boolean isRedacted(String column) {
        return redactedColumns.contains(column);
    }

    public boolean isWritable(String column) {
        return columns.contains(column);
    }

    /** Whether {@code column} may appear in find criteria. */
    public boolean isQueryable(String column) {
        return primaryKey.equals(column) || columns.contains(column) || generatedColumns.contains(column);
    }

    public boolean isSortable(String column) {
        return sortableColumns.contains(column);
    }

    @Override
    public String toString() {
        return "TableDescriptor[" + name + "]";
    }

    private static String checkIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches())
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        return identifier;
    }

    public static final class Builder {
        private final String name;
        private String primaryKey = "id";
        private final Set<String> columns = new LinkedHashSet<>();
        private final Set<String> generatedColumns = new LinkedHashSet<>();
        private final Set<String> sortableColumns = new LinkedHashSet<>();
        private final Set<String> redactedColumns = new LinkedHashSet<>();

        private Builder(String name) {
            this.name = checkIdentifier(name);
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = checkIdentifier(primaryKey);
            return this;
        }

        public Builder columns(String... names) {
            for (String n : names)
                columns.add(checkIdentifier(n));
            return this;
        }

        /** Adds {@code created_at, updated_at, created_by, updated_by}. */
        public Builder auditColumns() {
            return columns(RecordStore.CREATED_AT, RecordStore.UPDATED_AT,
                    RecordStore.CREATED_BY, RecordStore.UPDATED_BY);
        }

        public Builder generated(String... names) {
            for (String n : names)
                generatedColumns.add(checkIdentifier(n));
            return this;
        }

        public Builder sortable(String... names) {
            for (String n : names)
                sortableColumns.add(checkIdentifier(n));
            return this;
        }

        /** Columns whose values never reach the audit trail, e.g. secrets. */
        public Builder redacted(String... names) {
            for (String n : names)
                redactedColumns.add(checkIdentifier(n));
            return this;
        }

        /**
         * @throws IllegalArgumentException if a sortable column is not a
         *                                  column of the table
         */
        public TableDescriptor build() {
            for (String s : sortableColumns) {
                if (!s.equals(primaryKey) && !columns.contains(s) && !generatedColumns.contains(s))
                    throw new IllegalArgumentException("Sortable column '" + s + "' is not a column of " + name);
            }
            for (String g : generatedColumns) {
                if (columns.contains(g))
                    throw new IllegalArgumentException("Column '" + g + "' cannot be both writable and generated");
            }
            sortableColumns.add(primaryKey);
            return new TableDescriptor(this);
        }
    }
}
