package com.phillippitts.actiontracker.config.properties;

import com.phillippitts.actiontracker.service.render.OutputFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed properties controlling what the action tracker records and where summaries go.
 *
 * <p>Set once at startup and read-only afterwards. Every argument may be null; nulls resolve to
 * the defaults documented on each getter, so tests can build an instance with only the values they
 * care about.
 */
@Validated
@ConfigurationProperties(prefix = "action-tracker")
public class ActionTrackerProperties {

    /** System tables skipped unless {@code ignored-tables} is overridden. */
    public static final List<String> DEFAULT_IGNORED_TABLES = List.of(
            "pg_attribute", "pg_index", "pg_class", "pg_namespace",
            "pg_type", "ar_internal_metadata", "schema_migrations");

    public static final List<String> DEFAULT_EXCLUDED_PATH_PREFIXES = List.of("/assets", "/health", "/favicon");

    public static final List<String> DEFAULT_EXCLUDED_PATH_SUFFIXES =
            List.of(".js", ".css", ".png", ".jpg", ".gif", ".ico");

    /**
     * One service detection rule. The pattern is compiled as written, so prefix it with
     * {@code (?i)} to ignore case. Without a pattern the name itself is matched as a
     * case-insensitive substring.
     */
    public record ServicePattern(@NotBlank String name, String pattern) {

        public boolean hasPattern() {
            return pattern != null && !pattern.isBlank();
        }
    }

    private final boolean enabled;
    private final boolean printToLog;
    private final boolean writeToFile;
    private final String logFilePath;

    private final OutputFormat printFormat;
    private final OutputFormat logFormat;

    private final boolean colorize;
    @Valid
    private final List<ServicePattern> services;
    private final List<String> ignoredTables;
    private final List<String> ignoredControllers;
    private final Map<String, List<String>> ignoredActions;
    private final List<String> excludedPathPrefixes;
    private final List<String> excludedPathSuffixes;

    /**
     * @param outputFormat deprecated single-format switch; applies to both channels when neither
     *                     {@code printFormat} nor {@code logFormat} is given
     */
    @ConstructorBinding
    public ActionTrackerProperties(Boolean enabled,
                                   Boolean printToLog,
                                   Boolean writeToFile,
                                   String logFilePath,
                                   OutputFormat printFormat,
                                   OutputFormat logFormat,
                                   OutputFormat outputFormat,
                                   Boolean colorize,
                                   List<ServicePattern> services,
                                   List<String> ignoredTables,
                                   List<String> ignoredControllers,
                                   Map<String, List<String>> ignoredActions,
                                   List<String> excludedPathPrefixes,
                                   List<String> excludedPathSuffixes) {
        this.enabled = enabled == null ? true : enabled;
        this.printToLog = printToLog == null ? true : printToLog;
        this.writeToFile = writeToFile == null ? false : writeToFile;
        this.logFilePath = (logFilePath == null || logFilePath.isBlank()) ? null : logFilePath;

        OutputFormat resolvedPrint = printFormat;
        OutputFormat resolvedLog = logFormat;
        if (outputFormat != null && printFormat == null && logFormat == null) {
            resolvedPrint = outputFormat;
            resolvedLog = outputFormat;
        }
        this.printFormat = resolvedPrint == null ? OutputFormat.TABLE : resolvedPrint;
        this.logFormat = resolvedLog == null ? this.printFormat : resolvedLog;

        this.colorize = colorize == null ? true : colorize;
        this.services = services == null ? List.of() : List.copyOf(services);
        this.ignoredTables = ignoredTables == null ? DEFAULT_IGNORED_TABLES : List.copyOf(ignoredTables);
        this.ignoredControllers = ignoredControllers == null ? List.of() : List.copyOf(ignoredControllers);
        // values may be null ("ignore every action"), which rules out Map.copyOf
        this.ignoredActions = ignoredActions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(ignoredActions));
        this.excludedPathPrefixes = excludedPathPrefixes == null
                ? DEFAULT_EXCLUDED_PATH_PREFIXES : List.copyOf(excludedPathPrefixes);
        this.excludedPathSuffixes = excludedPathSuffixes == null
                ? DEFAULT_EXCLUDED_PATH_SUFFIXES : List.copyOf(excludedPathSuffixes);
    }

    /** All defaults: print tables to the log, no file output, default ignore lists. */
    public static ActionTrackerProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Whether the request filter tracks anything at all. Default: true. */
    public boolean isEnabled() {
        return enabled;
    }

    /** Whether summaries are printed to the application log. Default: true. */
    public boolean isPrintToLog() {
        return printToLog;
    }

    /** Whether summaries go to {@link #getLogFilePath()}. Default: false. */
    public boolean isWriteToFile() {
        return writeToFile;
    }

    /** Target of the file channel, or null when not configured. */
    public Path getLogFilePath() {
        return logFilePath == null ? null : Path.of(logFilePath);
    }

    /** True when file output is enabled and a path is configured. */
    public boolean isFileOutputActive() {
        return writeToFile && logFilePath != null;
    }

    /** Format of the print channel. Default: {@link OutputFormat#TABLE}. */
    public OutputFormat getPrintFormat() {
        return printFormat;
    }

    /** Format of the file channel. Defaults to {@link #getPrintFormat()}. */
    public OutputFormat getLogFormat() {
        return logFormat;
    }

    /** Whether table output on the print channel carries ANSI colours. Default: true. */
    public boolean isColorize() {
        return colorize;
    }

    /** Configured service rules; empty means the built-in defaults apply. */
    public List<ServicePattern> getServices() {
        return services;
    }

    public List<String> getIgnoredTables() {
        return ignoredTables;
    }

    public List<String> getIgnoredControllers() {
        return ignoredControllers;
    }

    /**
     * Controller name ({@code ""} or {@code "*"} for every controller) to ignored actions.
     * A null or empty list ignores the whole controller.
     */
    public Map<String, List<String>> getIgnoredActions() {
        return ignoredActions;
    }

    public List<String> getExcludedPathPrefixes() {
        return excludedPathPrefixes;
    }

    public List<String> getExcludedPathSuffixes() {
        return excludedPathSuffixes;
    }

    /** Programmatic construction for hosts that configure the tracker without Spring binding. */
    public static final class Builder {
        private Boolean enabled;
        private Boolean printToLog;
        private Boolean writeToFile;
        private String logFilePath;
        private OutputFormat printFormat;
        private OutputFormat logFormat;
        private OutputFormat outputFormat;
        private Boolean colorize;
        private List<ServicePattern> services;
        private List<String> ignoredTables;
        private List<String> ignoredControllers;
        private Map<String, List<String>> ignoredActions;
        private List<String> excludedPathPrefixes;
        private List<String> excludedPathSuffixes;

        private Builder() {
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder printToLog(boolean printToLog) {
            this.printToLog = printToLog;
            return this;
        }

        public Builder writeToFile(boolean writeToFile) {
            this.writeToFile = writeToFile;
            return this;
        }

        public Builder logFilePath(Path logFilePath) {
            this.logFilePath = logFilePath == null ? null : logFilePath.toString();
            return this;
        }

        public Builder printFormat(OutputFormat printFormat) {
            this.printFormat = printFormat;
            return this;
        }

        public Builder logFormat(OutputFormat logFormat) {
            this.logFormat = logFormat;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder colorize(boolean colorize) {
            this.colorize = colorize;
            return this;
        }

        public Builder services(List<ServicePattern> services) {
            this.services = services;
            return this;
        }

        public Builder ignoredTables(List<String> ignoredTables) {
            this.ignoredTables = ignoredTables;
            return this;
        }

        public Builder ignoredControllers(List<String> ignoredControllers) {
            this.ignoredControllers = ignoredControllers;
            return this;
        }

        public Builder ignoredActions(Map<String, List<String>> ignoredActions) {
            this.ignoredActions = ignoredActions;
            return this;
        }

        public Builder excludedPathPrefixes(List<String> excludedPathPrefixes) {
            this.excludedPathPrefixes = excludedPathPrefixes;
            return this;
        }

        public Builder excludedPathSuffixes(List<String> excludedPathSuffixes) {
            this.excludedPathSuffixes = excludedPathSuffixes;
            return this;
        }

        public ActionTrackerProperties build() {
            return new ActionTrackerProperties(enabled, printToLog, writeToFile, logFilePath,
                    printFormat, logFormat, outputFormat, colorize, services, ignoredTables,
                    ignoredControllers, ignoredActions, excludedPathPrefixes, excludedPathSuffixes);
        }
    }
}
