package com.phillippitts.actiontracker.service.classify;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects external services from captured lifecycle lines.
 *
 * <p>Each line is tested against every rule and each match contributes the rule's name. The
 * result is deduplicated in detection order and not sorted.
 */
public final class ServiceDetector {

    /** Built-in rules used when no services are configured. All ignore case. */
    public static final List<ServiceRule> DEFAULT_RULES = List.of(
            NamedPattern.ignoringCase("Pusher", "pusher"),
            NamedPattern.ignoringCase("Honeybadger", "honeybadger"),
            NamedPattern.ignoringCase("Redis", "redis"),
            NamedPattern.ignoringCase("Sidekiq", "sidekiq"),
            NamedPattern.ignoringCase("ActionMailer", "mail|email"),
            NamedPattern.ignoringCase("HTTP", "http|api"));

    private final List<ServiceRule> rules;

    public ServiceDetector(List<ServiceRule> rules) {
        this.rules = (rules == null || rules.isEmpty()) ? DEFAULT_RULES : List.copyOf(rules);
    }

    public static ServiceDetector withDefaults() {
        return new ServiceDetector(DEFAULT_RULES);
    }

    /**
     * Builds rules from configuration: entries with a pattern become {@link NamedPattern} compiled
     * as written, entries with only a name become {@link SubstringMatch}.
     *
     * @throws java.util.regex.PatternSyntaxException if a configured pattern is invalid
     */
    public static ServiceDetector from(ActionTrackerProperties props) {
        return new ServiceDetector(toRules(props.getServices()));
    }

    static List<ServiceRule> toRules(List<ActionTrackerProperties.ServicePattern> patterns) {
        List<ServiceRule> rules = new ArrayList<>();
        if (patterns == null) {
            return rules;
        }
        for (ActionTrackerProperties.ServicePattern p : patterns) {
            if (p == null || p.name() == null || p.name().isBlank()) {
                continue;
            }
            rules.add(p.hasPattern() ? NamedPattern.of(p.name(), p.pattern()) : new SubstringMatch(p.name()));
        }
        return rules;
    }

    public List<ServiceRule> rules() {
        return rules;
    }

    public Set<String> detectServices(List<String> lines) {
        Set<String> detected = new LinkedHashSet<>();
        if (lines == null) {
            return detected;
        }
        for (String line : lines) {
            for (ServiceRule rule : rules) {
                if (rule.matches(line)) {
                    detected.add(rule.name());
                }
            }
        }
        return detected;
    }
}
