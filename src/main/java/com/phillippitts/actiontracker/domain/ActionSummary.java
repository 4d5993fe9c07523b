package com.phillippitts.actiontracker.domain;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Immutable input to the renderers and accumulators.
 *
 * <p>{@code readTables} and {@code writeTables} are sorted and unique. {@code services} keeps
 * detection order; each output format sorts it as it needs.
 *
 * @param readTables  tables read during the unit of work
 * @param writeTables tables written during the unit of work
 * @param services    services detected from captured lines
 * @param actionLabel {@code Controller#action}, or null when no action was identified
 */
public record ActionSummary(List<String> readTables,
                            List<String> writeTables,
                            List<String> services,
                            String actionLabel) {

    /** Label used when no action identity was captured. */
    public static final String UNKNOWN_ACTION = "Unknown";

    public ActionSummary {
        readTables = List.copyOf(readTables);
        writeTables = List.copyOf(writeTables);
        services = List.copyOf(services);
    }

    public static ActionSummary of(Collection<String> read,
                                   Collection<String> write,
                                   Collection<String> services,
                                   String actionLabel) {
        return new ActionSummary(sortedUnique(read), sortedUnique(write),
                services.stream().distinct().toList(), actionLabel);
    }

    public boolean isEmpty() {
        return readTables.isEmpty() && writeTables.isEmpty() && services.isEmpty();
    }

    /** Action label, or {@value #UNKNOWN_ACTION} when absent. */
    public String labelOrUnknown() {
        return actionLabel == null ? UNKNOWN_ACTION : actionLabel;
    }

    public List<String> sortedServices() {
        return sortedUnique(services);
    }

    /** Sorted union of read and written tables. */
    public List<String> allTables() {
        TreeSet<String> all = new TreeSet<>(readTables);
        all.addAll(writeTables);
        return List.copyOf(all);
    }

    private static List<String> sortedUnique(Collection<String> values) {
        return List.copyOf(new TreeSet<>(values));
    }
}
