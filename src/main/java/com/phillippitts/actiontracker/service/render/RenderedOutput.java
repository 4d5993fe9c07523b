package com.phillippitts.actiontracker.service.render;

/**
 * Text produced by a renderer.
 *
 * @param colored text for consoles (identical to {@code plain} for formats without colour)
 * @param plain   text without escape codes, safe for files
 */
public record RenderedOutput(String colored, String plain) {

    public static RenderedOutput uncolored(String text) {
        return new RenderedOutput(text, text);
    }

    public String select(boolean colorize) {
        return colorize ? colored : plain;
    }
}
