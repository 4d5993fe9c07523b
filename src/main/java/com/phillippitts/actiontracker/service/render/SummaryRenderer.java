package com.phillippitts.actiontracker.service.render;

import com.phillippitts.actiontracker.domain.ActionSummary;

/** Stateless conversion of one action summary into text. */
public interface SummaryRenderer {

    /** Message used by every format when nothing was recorded. */
    String EMPTY_MESSAGE = "No models or services accessed during this request.";

    OutputFormat format();

    RenderedOutput render(ActionSummary summary);
}
