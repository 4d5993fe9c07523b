package com.phillippitts.actiontracker.service.subscription;

import java.util.Map;

/** Receives events routed by {@link SubscriptionManager}. */
public interface TrackingEventHandler {

    void onDataAccess(String sql);

    void onLifecycleEvent(String name, Map<String, Object> payload);

    /**
     * Any other event seen on the bus.
     *
     * @param name    simple class name of the payload, or of the event when it carries none
     * @param message the payload's (or event's) string form
     */
    void onGenericEvent(String name, String message);
}
