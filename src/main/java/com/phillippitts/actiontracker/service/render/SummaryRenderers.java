package com.phillippitts.actiontracker.service.render;

import java.util.EnumMap;
import java.util.Map;

/** Looks up the renderer for an {@link OutputFormat}. */
public final class SummaryRenderers {

    private static final Map<OutputFormat, SummaryRenderer> RENDERERS = new EnumMap<>(OutputFormat.class);

    static {
        register(new TableRenderer());
        register(new CsvRenderer());
        register(new JsonRenderer());
    }

    private SummaryRenderers() {}

    private static void register(SummaryRenderer renderer) {
        RENDERERS.put(renderer.format(), renderer);
    }

    public static SummaryRenderer forFormat(OutputFormat format) {
        return RENDERERS.get(format == null ? OutputFormat.TABLE : format);
    }
}
