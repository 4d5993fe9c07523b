package com.phillippitts.actiontracker.testutil;

import com.phillippitts.actiontracker.service.sink.SummarySink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for SummarySink that keeps every written block for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 */
public class CapturingSink implements SummarySink {
    private final List<String> written = new CopyOnWriteArrayList<>();

    @Override
    public void write(String text) {
        written.add(text);
    }

    public List<String> written() {
        return written;
    }

    /**
     * Returns the last written block, or null if nothing was written.
     */
    public String last() {
        return written.isEmpty() ? null : written.get(written.size() - 1);
    }

    public void clear() {
        written.clear();
    }
}
