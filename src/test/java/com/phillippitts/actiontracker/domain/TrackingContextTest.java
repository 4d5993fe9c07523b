package com.phillippitts.actiontracker.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingContextTest {

    @Test
    void recordsReadsAndWritesSeparately() {
        TrackingContext ctx = TrackingContext.empty();

        ctx.record(new TableAccess("users", AccessMode.READ));
        ctx.record(new TableAccess("posts", AccessMode.WRITE));
        ctx.record(new TableAccess("users", AccessMode.READ));

        assertThat(ctx.readTables()).containsExactly("users");
        assertThat(ctx.writeTables()).containsExactly("posts");
    }

    @Test
    void firstActionIdentityWins() {
        TrackingContext ctx = TrackingContext.empty();

        assertThat(ctx.identify(new ActionIdentity("UsersController", "show"))).isTrue();
        assertThat(ctx.identify(new ActionIdentity("PostsController", "index"))).isFalse();

        assertThat(ctx.actionIdentity()).hasValueSatisfying(id ->
                assertThat(id.label()).isEqualTo("UsersController#show"));
    }

    @Test
    void skipsEmptyCapturedLines() {
        TrackingContext ctx = TrackingContext.empty();

        ctx.captureLine("");
        ctx.captureLine(null);
        ctx.captureLine("Template: users/show");

        assertThat(ctx.capturedLines()).containsExactly("Template: users/show");
    }

    @Test
    void emptyContextReportsEmpty() {
        assertThat(TrackingContext.empty().isEmpty()).isTrue();
        assertThat(TrackingContext.empty().actionIdentity()).isEmpty();
    }

    @Test
    void exposedCollectionsAreReadOnly() {
        TrackingContext ctx = TrackingContext.empty();

        assertThatThrownBy(() -> ctx.readTables().add("users"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ctx.capturedLines().add("line"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
