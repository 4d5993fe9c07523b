package com.phillippitts.actiontracker.domain;

import java.util.Objects;

/**
 * Controller and action handling the current unit of work.
 *
 * @param controller controller name, e.g. {@code UsersController}
 * @param action     handler method name, e.g. {@code show}
 */
public record ActionIdentity(String controller, String action) {

    public ActionIdentity {
        Objects.requireNonNull(controller, "controller must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    /** Accumulation key and display label: {@code Controller#action}. */
    public String label() {
        return controller + '#' + action;
    }
}
