package com.phillippitts.actiontracker.service.render;

import com.phillippitts.actiontracker.domain.ActionSummary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableRendererTest {

    private final TableRenderer renderer = new TableRenderer();

    @Test
    void rendersAlignedTable() {
        ActionSummary summary = ActionSummary.of(
                List.of("users", "posts"), List.of("comments"), List.of("Redis"), null);

        String out = renderer.render(summary, false);

        assertThat(out).isEqualTo(
                "Models and Services accessed during request:\n"
                + "+-------------+----------------+-------------------+\n"
                + "| Models Read | Models Written | Services Accessed |\n"
                + "+-------------+----------------+-------------------+\n"
                + "| posts       | comments       | Redis             |\n"
                + "| users       |                |                   |\n"
                + "+-------------+----------------+-------------------+\n");
    }

    @Test
    void widensColumnsForLongCells() {
        ActionSummary summary = ActionSummary.of(
                List.of("very_long_table_name_here"), List.of(), List.of(), "UsersController#show");

        String out = renderer.render(summary, false);

        assertThat(out).startsWith("UsersController#show - Models and Services accessed during request:\n");
        assertThat(out).contains("| very_long_table_name_here | ");
        assertThat(out).contains("+" + "-".repeat("very_long_table_name_here".length() + 2) + "+");
    }

    @Test
    void emptySummaryIncludesLabelAndMessage() {
        String out = renderer.render(ActionSummary.of(List.of(), List.of(), List.of(), "X#y"), false);

        assertThat(out).contains("No models or services accessed during this request.");
        assertThat(out).contains("X#y");
        assertThat(out).isEqualTo("X#y: No models or services accessed during this request.\n");
    }

    @Test
    void emptySummaryWithoutLabel() {
        String out = renderer.render(ActionSummary.of(List.of(), List.of(), List.of(), null), false);

        assertThat(out).isEqualTo("No models or services accessed during this request.\n");
    }

    @Test
    void plainOutputHasNoEscapeCodes() {
        ActionSummary summary = ActionSummary.of(List.of("users"), List.of("posts"), List.of("Redis"), "A#b");

        RenderedOutput out = renderer.render(summary);

        assertThat(out.plain()).doesNotContain("\u001B[");
        assertThat(out.colored()).contains("\u001B[33mA#b\u001B[0m");
        assertThat(out.colored()).contains("\u001B[32mModels Read");
    }

    @Test
    void coloredEmptySummaryColorsLabel() {
        String out = renderer.render(ActionSummary.of(List.of(), List.of(), List.of(), "X#y"), true);

        assertThat(out).startsWith("\u001B[33mX#y\u001B[0m: ");
    }
}
