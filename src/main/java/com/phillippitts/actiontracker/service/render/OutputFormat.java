package com.phillippitts.actiontracker.service.render;

/** Output formats for both the print channel and the file channel. */
public enum OutputFormat {
    TABLE,
    CSV,
    JSON;

    /** True for formats that are merged into the accumulation file instead of appended as log lines. */
    public boolean isAccumulated() {
        return this != TABLE;
    }
}
