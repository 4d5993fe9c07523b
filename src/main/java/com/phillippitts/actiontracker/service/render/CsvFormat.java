package com.phillippitts.actiontracker.service.render;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.phillippitts.actiontracker.domain.AccessMode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Cell vocabulary and CSV writing shared by the CSV renderer and the CSV accumulator.
 */
public final class CsvFormat {

    public static final String ACTION_HEADER = "Action";
    public static final String SERVICE_USED = "Y";
    public static final String NOT_ACCESSED = AccessMode.NONE_CODE;

    private CsvFormat() {}

    /** Cell for a table column: {@code RW}, {@code R}, {@code W} or {@code -}. */
    public static String tableCell(String table, Collection<String> read, Collection<String> write) {
        Set<AccessMode> modes = EnumSet.noneOf(AccessMode.class);
        if (read.contains(table)) {
            modes.add(AccessMode.READ);
        }
        if (write.contains(table)) {
            modes.add(AccessMode.WRITE);
        }
        return AccessMode.toCode(modes);
    }

    /** Cell for a service column: {@code Y} or {@code -}. */
    public static String serviceCell(String service, Collection<String> services) {
        return services.contains(service) ? SERVICE_USED : NOT_ACCESSED;
    }

    /**
     * Writes rows as CSV text, one {@code \n}-terminated record per row. Fields are quoted only
     * when they contain a separator, quote or line break.
     */
    public static String write(List<String[]> rows) {
        StringWriter out = new StringWriter();
        try (ICSVWriter writer = new CSVWriterBuilder(out).withLineEnd(ICSVWriter.DEFAULT_LINE_END).build()) {
            writer.writeAll(rows, false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString();
    }
}
