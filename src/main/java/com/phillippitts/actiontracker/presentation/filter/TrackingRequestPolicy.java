package com.phillippitts.actiontracker.presentation.filter;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;

import java.util.List;

/**
 * Decides per request whether tracking applies: off when the tracker is disabled, and for
 * static assets, health checks and similar paths.
 */
public final class TrackingRequestPolicy {

    private final boolean enabled;
    private final List<String> excludedPrefixes;
    private final List<String> excludedSuffixes;

    public TrackingRequestPolicy(ActionTrackerProperties props) {
        this.enabled = props.isEnabled();
        this.excludedPrefixes = props.getExcludedPathPrefixes();
        this.excludedSuffixes = props.getExcludedPathSuffixes();
    }

    public boolean shouldTrack(String path) {
        if (!enabled) {
            return false;
        }
        if (path == null) {
            return true;
        }
        for (String prefix : excludedPrefixes) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        for (String suffix : excludedSuffixes) {
            if (path.endsWith(suffix)) {
                return false;
            }
        }
        return true;
    }
}
