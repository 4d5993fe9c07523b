package com.phillippitts.actiontracker.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActionSummaryTest {

    @Test
    void sortsTablesButKeepsServiceDetectionOrder() {
        ActionSummary summary = ActionSummary.of(
                List.of("users", "accounts", "users"),
                List.of("posts", "audits"),
                List.of("Redis", "HTTP", "Redis"),
                "UsersController#show");

        assertThat(summary.readTables()).containsExactly("accounts", "users");
        assertThat(summary.writeTables()).containsExactly("audits", "posts");
        assertThat(summary.services()).containsExactly("Redis", "HTTP");
        assertThat(summary.sortedServices()).containsExactly("HTTP", "Redis");
    }

    @Test
    void allTablesIsSortedUnion() {
        ActionSummary summary = ActionSummary.of(List.of("users", "posts"), List.of("users", "audits"), List.of(), null);

        assertThat(summary.allTables()).containsExactly("audits", "posts", "users");
    }

    @Test
    void missingLabelFallsBackToUnknown() {
        ActionSummary summary = ActionSummary.of(List.of(), List.of(), List.of(), null);

        assertThat(summary.labelOrUnknown()).isEqualTo("Unknown");
        assertThat(summary.isEmpty()).isTrue();
    }
}
