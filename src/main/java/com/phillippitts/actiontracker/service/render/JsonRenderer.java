package com.phillippitts.actiontracker.service.render;

import com.phillippitts.actiontracker.domain.ActionSummary;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Renders the current action as {@code "Label: {read, write, services}"} with pretty-printed JSON.
 */
public final class JsonRenderer implements SummaryRenderer {

    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String SERVICES = "services";

    static final int INDENT = 2;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public RenderedOutput render(ActionSummary summary) {
        return RenderedOutput.uncolored(summary.labelOrUnknown() + ": " + toJson(summary).toString(INDENT));
    }

    /** The summary as a {@code {read, write, services}} object with sorted arrays. */
    public static JSONObject toJson(ActionSummary summary) {
        JSONObject json = new JSONObject();
        json.put(READ, new JSONArray(summary.readTables()));
        json.put(WRITE, new JSONArray(summary.writeTables()));
        json.put(SERVICES, new JSONArray(summary.sortedServices()));
        return json;
    }
}
