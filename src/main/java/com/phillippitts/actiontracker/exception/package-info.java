/**
 * Exception hierarchy for the action tracker.
 *
 * <p>{@link com.phillippitts.actiontracker.exception.ActionTrackerException} is the unchecked base.
 * Accumulation failures are reported as
 * {@link com.phillippitts.actiontracker.exception.AccumulationException} and are logged and
 * swallowed by the tracker so a failing file never breaks the request being tracked.
 *
 * @since 1.0
 */
package com.phillippitts.actiontracker.exception;
