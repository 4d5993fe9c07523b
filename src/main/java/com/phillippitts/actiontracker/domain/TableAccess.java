package com.phillippitts.actiontracker.domain;

/** A table name extracted from one SQL statement, together with how it was accessed. */
public record TableAccess(String table, AccessMode mode) { }
