package com.phillippitts.actiontracker.service.classify;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import com.phillippitts.actiontracker.domain.AccessMode;
import com.phillippitts.actiontracker.domain.TableAccess;
import com.phillippitts.actiontracker.service.policy.IgnorePolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StatementClassifierTest {

    private final StatementClassifier classifier =
            new StatementClassifier(IgnorePolicy.from(ActionTrackerProperties.defaults()));

    @Test
    void selectIsRead() {
        assertThat(classifier.classify("SELECT * FROM users WHERE id = 1"))
                .contains(new TableAccess("users", AccessMode.READ));
    }

    @Test
    void selectWithLeadingWhitespaceAndLowercaseIsRead() {
        assertThat(classifier.classify("  \n select id from accounts"))
                .contains(new TableAccess("accounts", AccessMode.READ));
    }

    @Test
    void insertIsWrite() {
        assertThat(classifier.classify("INSERT INTO posts (title) VALUES ('test')"))
                .contains(new TableAccess("posts", AccessMode.WRITE));
    }

    @Test
    void updateIsWrite() {
        assertThat(classifier.classify("UPDATE comments SET content = 'updated' WHERE id = 1"))
                .contains(new TableAccess("comments", AccessMode.WRITE));
    }

    @Test
    void deleteIsWrite() {
        assertThat(classifier.classify("DELETE FROM sessions WHERE expired = true"))
                .contains(new TableAccess("sessions", AccessMode.WRITE));
    }

    @Test
    void quotedIdentifiersAreUnquoted() {
        assertThat(classifier.classify("SELECT \"users\".* FROM \"users\" LIMIT 1"))
                .contains(new TableAccess("users", AccessMode.READ));
        assertThat(classifier.classify("INSERT INTO `orders` (id) VALUES (1)"))
                .contains(new TableAccess("orders", AccessMode.WRITE));
    }

    @Test
    void firstReferencedTableWins() {
        assertThat(classifier.classify("SELECT * FROM users JOIN posts ON posts.user_id = users.id"))
                .contains(new TableAccess("users", AccessMode.READ));
    }

    @Test
    void unrecognisedStatementsAreDropped() {
        assertThat(classifier.classify("BEGIN")).isEmpty();
        assertThat(classifier.classify("SET search_path TO public")).isEmpty();
        assertThat(classifier.classify("")).isEmpty();
        assertThat(classifier.classify(null)).isEmpty();
    }

    @Test
    void defaultIgnoredTablesAreDropped() {
        assertThat(classifier.classify("SELECT * FROM pg_attribute")).isEmpty();
        assertThat(classifier.classify("INSERT INTO schema_migrations (version) VALUES ('1')")).isEmpty();
    }

    @Test
    void ignoredTablesMatchCaseInsensitively() {
        StatementClassifier custom = new StatementClassifier(
                new IgnorePolicy(List.of("PG_ATTRIBUTE", "custom_ignore"), null, null));

        assertThat(custom.classify("select * from pg_attribute")).isEmpty();
        assertThat(custom.classify("SELECT * FROM Custom_Ignore")).isEmpty();
        assertThat(custom.classify("SELECT * FROM users")).contains(new TableAccess("users", AccessMode.READ));
    }

    @Test
    void nullPolicyIgnoresNothing() {
        StatementClassifier open = new StatementClassifier(null);

        assertThat(open.classify("SELECT * FROM pg_attribute"))
                .contains(new TableAccess("pg_attribute", AccessMode.READ));
    }
}
