package com.phillippitts.actiontracker.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * How a table was touched during a unit of work.
 *
 * <p>Cell codes follow the accumulation file format: {@code R}, {@code W}, {@code RW} and {@code -}.
 */
public enum AccessMode {
    READ("R"),
    WRITE("W");

    /** Cell value for a table that was neither read nor written. */
    public static final String NONE_CODE = "-";

    private final String code;

    AccessMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Formats a set of modes as a single cell value.
     *
     * @param modes modes observed for one table (may be empty)
     * @return {@code RW}, {@code R}, {@code W} or {@code -}
     */
    public static String toCode(Set<AccessMode> modes) {
        if (modes == null || modes.isEmpty()) {
            return NONE_CODE;
        }
        StringBuilder sb = new StringBuilder(2);
        if (modes.contains(READ)) {
            sb.append(READ.code);
        }
        if (modes.contains(WRITE)) {
            sb.append(WRITE.code);
        }
        return sb.toString();
    }

    /**
     * Parses a cell value back into modes. Unknown values map to an empty set.
     */
    public static Set<AccessMode> fromCode(String code) {
        EnumSet<AccessMode> modes = EnumSet.noneOf(AccessMode.class);
        if (code == null) {
            return modes;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains(READ.code)) {
            modes.add(READ);
        }
        if (normalized.contains(WRITE.code)) {
            modes.add(WRITE);
        }
        return modes;
    }
}
