package com.phillippitts.actiontracker.exception;

/**
 * Unchecked root of the tracker's failures. The tracker catches these itself, so a request never
 * fails because its summary could not be written.
 */
public class ActionTrackerException extends RuntimeException {

    public ActionTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
