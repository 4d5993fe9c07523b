package com.phillippitts.actiontracker.service.subscription.event;

import java.util.Map;

/**
 * A named lifecycle notification from the web layer.
 *
 * <p>{@value #ACTION_STARTED} carries {@code controller} and {@code action}; {@value #TEMPLATE_RENDERED}
 * carries {@code identifier}. Any other name is captured as the payload's string form.
 */
public record LifecycleEvent(String name, Map<String, Object> payload) {

    public static final String ACTION_STARTED = "process_action";
    public static final String TEMPLATE_RENDERED = "render_template";

    public static final String CONTROLLER = "controller";
    public static final String ACTION = "action";
    public static final String IDENTIFIER = "identifier";

    public LifecycleEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static LifecycleEvent actionStarted(String controller, String action) {
        return new LifecycleEvent(ACTION_STARTED, Map.of(CONTROLLER, controller, ACTION, action));
    }

    public static LifecycleEvent templateRendered(String identifier) {
        return new LifecycleEvent(TEMPLATE_RENDERED, Map.of(IDENTIFIER, identifier));
    }
}
