package com.phillippitts.actiontracker.presentation.filter;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrackingRequestPolicyTest {

    private final TrackingRequestPolicy defaults = new TrackingRequestPolicy(ActionTrackerProperties.defaults());

    @Test
    void tracksApplicationPaths() {
        assertThat(defaults.shouldTrack("/users/1")).isTrue();
        assertThat(defaults.shouldTrack("/")).isTrue();
        assertThat(defaults.shouldTrack(null)).isTrue();
    }

    @Test
    void skipsDefaultPrefixesAndSuffixes() {
        assertThat(defaults.shouldTrack("/assets/logo.svg")).isFalse();
        assertThat(defaults.shouldTrack("/health")).isFalse();
        assertThat(defaults.shouldTrack("/favicon.ico")).isFalse();
        assertThat(defaults.shouldTrack("/static/app.css")).isFalse();
        assertThat(defaults.shouldTrack("/images/photo.png")).isFalse();
    }

    @Test
    void customExclusionsReplaceDefaults() {
        TrackingRequestPolicy policy = new TrackingRequestPolicy(ActionTrackerProperties.builder()
                .excludedPathPrefixes(List.of("/internal"))
                .excludedPathSuffixes(List.of())
                .build());

        assertThat(policy.shouldTrack("/internal/status")).isFalse();
        assertThat(policy.shouldTrack("/assets/app.js")).isTrue();
    }

    @Test
    void disabledTracksNothing() {
        TrackingRequestPolicy policy = new TrackingRequestPolicy(
                ActionTrackerProperties.builder().enabled(false).build());

        assertThat(policy.shouldTrack("/users/1")).isFalse();
    }
}
