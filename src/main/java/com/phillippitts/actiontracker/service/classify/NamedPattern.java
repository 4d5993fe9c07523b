package com.phillippitts.actiontracker.service.classify;

import java.util.Objects;
import java.util.regex.Pattern;

/** Matches a line when {@code pattern} is found anywhere in it. */
public record NamedPattern(String name, Pattern pattern) implements ServiceRule {

    public NamedPattern {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }

    /** Compiles {@code regex} as written; use an inline {@code (?i)} to ignore case. */
    public static NamedPattern of(String name, String regex) {
        return new NamedPattern(name, Pattern.compile(regex));
    }

    public static NamedPattern ignoringCase(String name, String regex) {
        return new NamedPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    @Override
    public boolean matches(String line) {
        return line != null && pattern.matcher(line).find();
    }
}
