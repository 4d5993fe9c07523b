package com.phillippitts.actiontracker.service.accumulate;

import com.phillippitts.actiontracker.domain.ActionSummary;
import com.phillippitts.actiontracker.service.render.JsonRenderer;
import com.phillippitts.actiontracker.service.render.OutputFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

/**
 * Accumulates summaries into a JSON object keyed by action label.
 *
 * <pre>
 * {
 *   "UsersController#show": {"read": ["users"], "write": [], "services": ["Redis"]}
 * }
 * </pre>
 *
 * Existing actions get the sorted union of old and new values per list; other entries are kept
 * as they are. Blank or unparsable content counts as an empty object.
 */
public final class JsonFileAccumulator implements SummaryAccumulator {

    private static final Logger LOG = LogManager.getLogger(JsonFileAccumulator.class);

    private static final int INDENT = 2;

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public void accumulate(Path file, ActionSummary summary) {
        LockedFileUpdater.update(file, content -> merge(content, summary));
    }

    String merge(String content, ActionSummary summary) {
        JSONObject data = parse(content);
        String label = summary.labelOrUnknown();
        JSONObject existing = data.optJSONObject(label);
        JSONObject incoming = JsonRenderer.toJson(summary);
        if (existing == null) {
            data.put(label, incoming);
        } else {
            JSONObject merged = new JSONObject();
            for (String key : List.of(JsonRenderer.READ, JsonRenderer.WRITE, JsonRenderer.SERVICES)) {
                merged.put(key, union(existing.optJSONArray(key), incoming.getJSONArray(key)));
            }
            data.put(label, merged);
        }
        return data.toString(INDENT);
    }

    static JSONObject parse(String content) {
        if (content == null || content.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(content.strip());
        } catch (JSONException e) {
            LOG.warn("Accumulation file is not a JSON object, starting over: {}", e.getMessage());
            return new JSONObject();
        }
    }

    private static JSONArray union(JSONArray existing, JSONArray incoming) {
        TreeSet<String> values = new TreeSet<>();
        if (existing != null) {
            for (int i = 0; i < existing.length(); i++) {
                values.add(existing.optString(i));
            }
        }
        for (int i = 0; i < incoming.length(); i++) {
            values.add(incoming.optString(i));
        }
        return new JSONArray(values);
    }
}
