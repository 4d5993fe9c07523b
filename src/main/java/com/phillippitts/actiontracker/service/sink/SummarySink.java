package com.phillippitts.actiontracker.service.sink;

/** Destination for rendered summaries. Only needs to write a block of text. */
@FunctionalInterface
public interface SummarySink {

    /** A sink that drops everything. */
    SummarySink DISCARD = text -> { };

    void write(String text);
}
