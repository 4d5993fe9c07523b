package com.phillippitts.actiontracker.service.render;

import com.phillippitts.actiontracker.domain.ActionSummary;

import java.util.List;

/**
 * Renders a summary as a three-column text table.
 *
 * <pre>
 * UsersController#show - Models and Services accessed during request:
 * +-------------+----------------+-------------------+
 * | Models Read | Models Written | Services Accessed |
 * +-------------+----------------+-------------------+
 * | users       | audits         | Redis             |
 * | posts       |                |                   |
 * +-------------+----------------+-------------------+
 * </pre>
 *
 * Column width is the longer of the header and the longest cell.
 */
public final class TableRenderer implements SummaryRenderer {

    static final String READ_HEADER = "Models Read";
    static final String WRITE_HEADER = "Models Written";
    static final String SERVICES_HEADER = "Services Accessed";
    static final String TITLE = "Models and Services accessed during request:";

    @Override
    public OutputFormat format() {
        return OutputFormat.TABLE;
    }

    @Override
    public RenderedOutput render(ActionSummary summary) {
        return new RenderedOutput(render(summary, true), render(summary, false));
    }

    /**
     * @param colorize whether the label and headers carry ANSI colours
     */
    public String render(ActionSummary summary, boolean colorize) {
        ConsoleColors colors = ConsoleColors.of(colorize);
        List<String> read = summary.readTables();
        List<String> write = summary.writeTables();
        List<String> services = summary.services();
        int rows = Math.max(read.size(), Math.max(write.size(), services.size()));

        if (rows == 0) {
            String label = summary.actionLabel() == null
                    ? ""
                    : colors.yellow() + summary.actionLabel() + colors.reset() + ": ";
            return label + EMPTY_MESSAGE + "\n";
        }

        int readWidth = width(READ_HEADER, read);
        int writeWidth = width(WRITE_HEADER, write);
        int servicesWidth = width(SERVICES_HEADER, services);
        String separator = "+" + "-".repeat(readWidth + 2)
                + "+" + "-".repeat(writeWidth + 2)
                + "+" + "-".repeat(servicesWidth + 2) + "+";

        StringBuilder sb = new StringBuilder();
        if (summary.actionLabel() != null) {
            sb.append(colors.yellow()).append(summary.actionLabel()).append(colors.reset()).append(" - ");
        }
        sb.append(TITLE).append('\n');
        sb.append(separator).append('\n');
        sb.append("| ")
                .append(colors.green()).append(pad(READ_HEADER, readWidth)).append(colors.reset())
                .append(" | ")
                .append(colors.red()).append(pad(WRITE_HEADER, writeWidth)).append(colors.reset())
                .append(" | ")
                .append(colors.blue()).append(pad(SERVICES_HEADER, servicesWidth)).append(colors.reset())
                .append(" |\n");
        sb.append(separator).append('\n');
        for (int i = 0; i < rows; i++) {
            sb.append("| ").append(pad(cell(read, i), readWidth))
                    .append(" | ").append(pad(cell(write, i), writeWidth))
                    .append(" | ").append(pad(cell(services, i), servicesWidth))
                    .append(" |\n");
        }
        sb.append(separator).append('\n');
        return sb.toString();
    }

    private static int width(String header, List<String> cells) {
        int w = header.length();
        for (String c : cells) {
            w = Math.max(w, c.length());
        }
        return w;
    }

    private static String cell(List<String> column, int row) {
        return row < column.size() ? column.get(row) : "";
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
