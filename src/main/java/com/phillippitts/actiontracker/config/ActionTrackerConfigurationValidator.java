package com.phillippitts.actiontracker.config;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates ActionTrackerProperties at startup to fail fast with actionable messages.
 */
class ActionTrackerConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(ActionTrackerConfigurationValidator.class);

    private final ActionTrackerProperties props;

    ActionTrackerConfigurationValidator(ActionTrackerProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        for (int i = 0; i < props.getServices().size(); i++) {
            ActionTrackerProperties.ServicePattern service = props.getServices().get(i);
            if (service == null || service.name() == null || service.name().isBlank()) {
                throw new IllegalArgumentException("Invalid action-tracker.services[" + i + "].name: "
                        + "must not be blank");
            }
            if (service.hasPattern()) {
                try {
                    Pattern.compile(service.pattern());
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid action-tracker.services[" + i + "].pattern '"
                            + service.pattern() + "' for service " + service.name() + ": " + e.getDescription(), e);
                }
            }
        }
        if (props.isWriteToFile() && props.getLogFilePath() == null) {
            LOG.warn("action-tracker.write-to-file=true but action-tracker.log-file-path is not set; "
                    + "file output is disabled");
        }
    }
}
