package de.bsommerfeld.assetledger.db;

import java.util.Objects;

/**
 * Ordering for {@link RecordStore#find}. The column must be in the table's
 * sortable allow-list.
 */
public record Sort(String column, Direction direction) {

    public enum Direction {
        ASC, DESC
    }

    public Sort {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(direction, "direction");
    }

    public static Sort asc(String column) {
        return new Sort(column, Direction.ASC);
    }

    public static Sort desc(String column) {
        return new Sort(column, Direction.DESC);
    }
}
