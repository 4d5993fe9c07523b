package com.phillippitts.actiontracker.service.policy;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which tables and which controller actions are left out of summaries.
 *
 * <p>Action rules are evaluated independently and any match ignores: a controller listed in
 * {@code ignoredControllers}, or an {@code ignoredActions} entry whose key is global ({@code ""} or
 * {@code "*"}) or equal to the controller and whose value is empty, null, or contains the action.
 * No rule can un-ignore another.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class IgnorePolicy {

    static final String GLOBAL_KEY = "";
    static final String GLOBAL_WILDCARD = "*";

    private final Set<String> ignoredTables;
    private final Set<String> ignoredControllers;
    private final Map<String, List<String>> ignoredActions;

    public IgnorePolicy(Collection<String> ignoredTables,
                        Collection<String> ignoredControllers,
                        Map<String, List<String>> ignoredActions) {
        this.ignoredTables = ignoredTables == null ? Set.of() : ignoredTables.stream()
                .filter(t -> t != null)
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.ignoredControllers = ignoredControllers == null ? Set.of() : Set.copyOf(ignoredControllers);
        this.ignoredActions = ignoredActions == null ? Map.of() : new LinkedHashMap<>(ignoredActions);
    }

    public static IgnorePolicy from(ActionTrackerProperties props) {
        return new IgnorePolicy(props.getIgnoredTables(), props.getIgnoredControllers(), props.getIgnoredActions());
    }

    /** A policy that ignores nothing. */
    public static IgnorePolicy none() {
        return new IgnorePolicy(null, null, null);
    }

    /** Case-insensitive check against the ignored table list. */
    public boolean isTableIgnored(String table) {
        return table != null && ignoredTables.contains(table.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns whether the summary for this controller action should be suppressed.
     * Never throws; a missing controller or action is never ignored.
     */
    public boolean shouldIgnore(String controller, String action) {
        if (controller == null || action == null) {
            return false;
        }
        if (ignoredControllers.contains(controller)) {
            return true;
        }
        for (Map.Entry<String, List<String>> entry : ignoredActions.entrySet()) {
            if (!appliesTo(entry.getKey(), controller)) {
                continue;
            }
            List<String> actions = entry.getValue();
            if (actions == null || actions.isEmpty() || actions.contains(action)) {
                return true;
            }
        }
        return false;
    }

    private static boolean appliesTo(String key, String controller) {
        return key == null
                || GLOBAL_KEY.equals(key)
                || GLOBAL_WILDCARD.equals(key)
                || key.equals(controller);
    }
}
