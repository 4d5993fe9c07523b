package com.phillippitts.actiontracker.service.render;

import com.phillippitts.actiontracker.domain.ActionSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a summary as a two-line CSV document: a header of {@code Action}, sorted tables and
 * sorted services, and one data row for the current action.
 */
public final class CsvRenderer implements SummaryRenderer {

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public RenderedOutput render(ActionSummary summary) {
        if (summary.isEmpty()) {
            return RenderedOutput.uncolored(CsvFormat.ACTION_HEADER + "\n" + EMPTY_MESSAGE + "\n");
        }
        List<String> tables = summary.allTables();
        List<String> services = summary.sortedServices();

        List<String> header = new ArrayList<>();
        header.add(CsvFormat.ACTION_HEADER);
        header.addAll(tables);
        header.addAll(services);

        List<String> row = new ArrayList<>();
        row.add(summary.labelOrUnknown());
        for (String table : tables) {
            row.add(CsvFormat.tableCell(table, summary.readTables(), summary.writeTables()));
        }
        for (String service : services) {
            row.add(CsvFormat.serviceCell(service, summary.services()));
        }
        return RenderedOutput.uncolored(CsvFormat.write(List.of(
                header.toArray(new String[0]),
                row.toArray(new String[0]))));
    }
}
