package de.bsommerfeld.assetledger.core.domain;

import java.util.regex.Pattern;

/**
 * The 10-digit fixed-width nomenclature code. Its positions encode the
 * classification of an item:
 *
 * <pre>
 *   CC GGG SS III
 *   │  │   │  └── item number   (positions 8–10)
 *   │  │   └───── subgroup      (positions 6–7)
 *   │  └───────── group         (positions 3–5)
 *   └──────────── class         (positions 1–2)
 * </pre>
 *
 * The same split is materialized by generated columns of the
 * {@code nomenclature} table, so lookups by class or group hit an index
 * instead of a {@code SUBSTR} scan.
 */
public record NomenclatureCode(String value) {

    public static final int LENGTH = 10;
    private static final Pattern FORMAT = Pattern.compile("\\d{" + LENGTH + "}");

    public NomenclatureCode {
        if (value == null || !FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    "Nomenclature code must consist of exactly " + LENGTH + " digits: " + value);
        }
    }

    /**
     * Parses a code, tolerating surrounding whitespace and the usual
     * {@code "CC GGG SS III"} / {@code "CC-GGG-SS-III"} spellings.
     *
     * @throws IllegalArgumentException if the remaining text is not 10 digits
     */
    public static NomenclatureCode parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Nomenclature code is missing");
        }
        return new NomenclatureCode(text.strip().replaceAll("[\\s-]", ""));
    }

    /** Returns {@code true} if {@code text} would be accepted by {@link #parse}. */
    public static boolean isValid(String text) {
        return text != null && FORMAT.matcher(text.strip().replaceAll("[\\s-]", "")).matches();
    }

    public String classCode() {
        return value.substring(0, 2);
    }

    public String groupCode() {
        return value.substring(2, 5);
    }

    public String subgroupCode() {
        return value.substring(5, 7);
    }

    public String itemNumber() {
        return value.substring(7, 10);
    }

    /** Human readable form with the four parts separated by spaces. */
    public String formatted() {
        return classCode() + " " + groupCode() + " " + subgroupCode() + " " + itemNumber();
    }

    @Override
    public String toString() {
        return value;
    }
}
