package com.phillippitts.actiontracker.service.classify;

/**
 * A rule that recognises one external service in a captured line.
 *
 * <p>Implementations: {@link NamedPattern} (regular expression) and {@link SubstringMatch}
 * (case-insensitive containment).
 */
public interface ServiceRule {

    /** Service name contributed when the rule matches. */
    String name();

    boolean matches(String line);
}
