package de.bsommerfeld.assetledger.db;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamp text as stored in {@code *_at} columns. Uses the same layout as
 * SQLite's {@code CURRENT_TIMESTAMP} so values written by the application and
 * by column defaults sort and compare alike. Column defaults are UTC, so the
 * clocks handed in here must be UTC clocks as well.
 */
public final class Timestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return LocalDateTime.now(clock).format(FORMAT);
    }

    public static String format(LocalDateTime dateTime) {
        return dateTime.format(FORMAT);
    }
}
