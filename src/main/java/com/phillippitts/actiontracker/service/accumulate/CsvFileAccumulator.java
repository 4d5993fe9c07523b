package com.phillippitts.actiontracker.service.accumulate;

import com.phillippitts.actiontracker.domain.AccessMode;
import com.phillippitts.actiontracker.domain.ActionSummary;
import com.phillippitts.actiontracker.service.render.CsvFormat;
import com.phillippitts.actiontracker.service.render.OutputFormat;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Accumulates summaries into a CSV matrix of actions by tables and services.
 *
 * <p>The header is recomputed on every write as the sorted union of the current tables and
 * services and every column already in the file, and the whole file is rewritten. Table cells
 * merge by access-mode union ({@code R} + {@code W} = {@code RW}); service cells become
 * {@code Y} when the service is seen and are never downgraded.
 *
 * <p>Rewriting the full file costs time linear in the number of actions on each request.
 */
public final class CsvFileAccumulator implements SummaryAccumulator {

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public void accumulate(Path file, ActionSummary summary) {
        LockedFileUpdater.update(file, content -> merge(content, summary));
    }

    String merge(String content, ActionSummary summary) {
        CsvTable table = CsvTable.parse(content);
        List<String> tables = summary.allTables();
        List<String> services = summary.sortedServices();

        TreeSet<String> header = new TreeSet<>(table.columns());
        header.addAll(tables);
        header.addAll(services);
        header.remove(CsvFormat.ACTION_HEADER);

        String label = summary.labelOrUnknown();
        Map<String, String> row = table.rows().computeIfAbsent(label, k -> new LinkedHashMap<>());
        for (String column : header) {
            String existing = row.getOrDefault(column, CsvFormat.NOT_ACCESSED);
            row.put(column, mergeCell(column, existing, summary, tables, services));
        }
        return table.render(List.copyOf(header));
    }

    private static String mergeCell(String column,
                                    String existing,
                                    ActionSummary summary,
                                    List<String> tables,
                                    List<String> services) {
        if (tables.contains(column)) {
            Set<AccessMode> modes = EnumSet.noneOf(AccessMode.class);
            modes.addAll(AccessMode.fromCode(existing));
            modes.addAll(AccessMode.fromCode(CsvFormat.tableCell(column, summary.readTables(), summary.writeTables())));
            return AccessMode.toCode(modes);
        }
        if (services.contains(column)) {
            return CsvFormat.SERVICE_USED;
        }
        return existing == null || existing.isBlank() ? CsvFormat.NOT_ACCESSED : existing;
    }
}
