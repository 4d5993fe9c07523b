package com.phillippitts.actiontracker.service.accumulate;

import com.phillippitts.actiontracker.domain.ActionSummary;
import com.phillippitts.actiontracker.exception.AccumulationException;
import com.phillippitts.actiontracker.service.render.OutputFormat;

import java.nio.file.Path;

/** Merges one action summary into a persisted accumulation file. */
public interface SummaryAccumulator {

    OutputFormat format();

    /**
     * Reads {@code file}, merges {@code summary} under its action label and rewrites the file.
     *
     * @throws AccumulationException if the file cannot be locked, read or written
     */
    void accumulate(Path file, ActionSummary summary);
}
