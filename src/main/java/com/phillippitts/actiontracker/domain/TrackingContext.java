package com.phillippitts.actiontracker.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable observations collected for one unit of work.
 *
 * <p>Owned by the thread that created it, so none of the mutators synchronize.
 */
public final class TrackingContext {

    private final Set<String> readTables = new LinkedHashSet<>();
    private final Set<String> writeTables = new LinkedHashSet<>();
    private final List<String> capturedLines = new ArrayList<>();
    private ActionIdentity actionIdentity;

    /** Returns a new context with nothing recorded. */
    public static TrackingContext empty() {
        return new TrackingContext();
    }

    public void record(TableAccess access) {
        if (access.mode() == AccessMode.READ) {
            readTables.add(access.table());
        } else {
            writeTables.add(access.table());
        }
    }

    public void captureLine(String line) {
        if (line != null && !line.isEmpty()) {
            capturedLines.add(line);
        }
    }

    /**
     * Sets the action identity unless one was already recorded.
     *
     * @return true if this call set the identity
     */
    public boolean identify(ActionIdentity identity) {
        if (actionIdentity != null || identity == null) {
            return false;
        }
        actionIdentity = identity;
        return true;
    }

    public Set<String> readTables() {
        return Collections.unmodifiableSet(readTables);
    }

    public Set<String> writeTables() {
        return Collections.unmodifiableSet(writeTables);
    }

    public List<String> capturedLines() {
        return Collections.unmodifiableList(capturedLines);
    }

    public Optional<ActionIdentity> actionIdentity() {
        return Optional.ofNullable(actionIdentity);
    }

    public boolean isEmpty() {
        return readTables.isEmpty() && writeTables.isEmpty() && capturedLines.isEmpty() && actionIdentity == null;
    }
}
