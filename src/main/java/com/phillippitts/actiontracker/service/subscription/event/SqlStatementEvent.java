package com.phillippitts.actiontracker.service.subscription.event;

/**
 * Published by the data-access layer for every statement it executes.
 *
 * <p>Publish it on the thread that runs the statement; the tracker attributes it to that thread's
 * unit of work.
 */
public record SqlStatementEvent(String sql) { }
