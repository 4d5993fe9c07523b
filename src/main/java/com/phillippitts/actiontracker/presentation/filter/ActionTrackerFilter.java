package com.phillippitts.actiontracker.presentation.filter;

import com.phillippitts.actiontracker.service.tracker.ActionTracker;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/**
 * Wraps each tracked HTTP request in an action-tracker unit of work.
 *
 * <p>Sequence: begin, run the chain, flush the summary, and end in {@code finally} so the
 * per-thread context is discarded on every exit path. The summary is only flushed when the chain
 * completes normally. Requests rejected by {@link TrackingRequestPolicy} and non-HTTP requests
 * pass straight through.
 */
public class ActionTrackerFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(ActionTrackerFilter.class);

    private final ActionTracker tracker;
    private final TrackingRequestPolicy policy;

    public ActionTrackerFilter(ActionTracker tracker, TrackingRequestPolicy policy) {
        this.tracker = tracker;
        this.policy = policy;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http) || !policy.shouldTrack(http.getRequestURI())) {
            chain.doFilter(request, response);
            return;
        }
        tracker.begin();
        try {
            chain.doFilter(request, response);
            flushQuietly(http);
        } finally {
            tracker.end();
        }
    }

    private void flushQuietly(HttpServletRequest http) {
        try {
            tracker.flush();
        } catch (RuntimeException e) {
            LOG.warn("Action tracker summary failed for {} {}: {}", http.getMethod(), http.getRequestURI(), e.toString());
        }
    }
}
