package com.phillippitts.actiontracker.integration;

import com.phillippitts.actiontracker.service.subscription.event.SqlStatementEvent;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Minimal host application for integration tests. Controllers publish the statements a
 * data-access layer would.
 */
@SpringBootApplication
public class TrackedApplication {

    @RestController
    static class UsersController {

        private final ApplicationEventPublisher publisher;

        UsersController(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
        }

        @GetMapping("/users/{id}")
        String show(@PathVariable("id") long id) {
            publisher.publishEvent(new SqlStatementEvent("SELECT \"users\".* FROM \"users\" WHERE \"users\".\"id\" = " + id));
            publisher.publishEvent(new SqlStatementEvent("SELECT * FROM pg_attribute"));
            return "user " + id;
        }

        @PostMapping("/users")
        String create() {
            publisher.publishEvent(new SqlStatementEvent("INSERT INTO \"users\" (\"name\") VALUES ('a')"));
            return "created";
        }
    }

    @RestController
    static class HealthController {

        @GetMapping("/ping")
        String ping() {
            return "pong";
        }
    }
}
