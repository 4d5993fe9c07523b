package com.phillippitts.actiontracker.service.classify;

import java.util.Locale;
import java.util.Objects;

/** Matches a line containing {@code text}, ignoring case. The text doubles as the service name. */
public record SubstringMatch(String text) implements ServiceRule {

    public SubstringMatch {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String name() {
        return text;
    }

    @Override
    public boolean matches(String line) {
        return line != null && line.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
    }
}
