package com.phillippitts.actiontracker.service.classify;

import com.phillippitts.actiontracker.domain.AccessMode;
import com.phillippitts.actiontracker.domain.TableAccess;
import com.phillippitts.actiontracker.service.policy.IgnorePolicy;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the first referenced table from a SQL statement and classifies it as read or write.
 *
 * <p>Best-effort pattern matching only: statements the pattern does not recognise produce no
 * classification and no error. A statement is a read iff it starts with {@code SELECT}.
 */
public final class StatementClassifier {

    private static final Pattern TABLE_REFERENCE =
            Pattern.compile("(FROM|INTO|UPDATE|INSERT INTO)\\s+[\"'`]?(\\w+)[\"'`]?", Pattern.CASE_INSENSITIVE);

    private static final Pattern SELECT_PREFIX = Pattern.compile("\\A\\s*SELECT", Pattern.CASE_INSENSITIVE);

    private final IgnorePolicy ignorePolicy;

    public StatementClassifier(IgnorePolicy ignorePolicy) {
        this.ignorePolicy = ignorePolicy == null ? IgnorePolicy.none() : ignorePolicy;
    }

    /**
     * @param sql raw statement text (may be null)
     * @return table and mode, or empty for unrecognised statements and ignored tables
     */
    public Optional<TableAccess> classify(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.empty();
        }
        Matcher m = TABLE_REFERENCE.matcher(sql);
        if (!m.find()) {
            return Optional.empty();
        }
        String table = m.group(2);
        if (ignorePolicy.isTableIgnored(table)) {
            return Optional.empty();
        }
        AccessMode mode = SELECT_PREFIX.matcher(sql).lookingAt() ? AccessMode.READ : AccessMode.WRITE;
        return Optional.of(new TableAccess(table, mode));
    }
}
