package com.phillippitts.actiontracker.service.subscription;

import com.phillippitts.actiontracker.service.subscription.event.LifecycleEvent;
import com.phillippitts.actiontracker.service.subscription.event.SqlStatementEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.PayloadApplicationEvent;
import org.springframework.context.event.ApplicationEventMulticaster;

import java.util.Optional;

/**
 * Attaches tracker listeners to Spring's event multicaster.
 *
 * <p>Two listeners are registered: one for {@link SqlStatementEvent} payloads and one for
 * everything else. {@link LifecycleEvent} payloads keep their name and payload map; any other event
 * reaches the handler as its string form, which feeds service detection.
 *
 * <p>The subscription is a process-wide singleton shared by every concurrent unit of work;
 * {@link #attach} and {@link #detach} are idempotent.
 *
 * <p>Multicasters dispatch synchronously on the publishing thread, so the handler resolves the
 * publishing thread's context and events never cross requests. Without a multicaster both
 * operations do nothing and the handler can still be called directly.
 *
 * <p><b>Thread Safety:</b> attach and detach synchronize on this instance.
 */
public class SubscriptionManager {

    private static final Logger LOG = LogManager.getLogger(SubscriptionManager.class);

    /** Statements carrying this marker are schema introspection and never tracked. */
    static final String SCHEMA_MARKER = "SCHEMA";

    private final ApplicationEventMulticaster multicaster;
    private Subscription subscription;

    /**
     * @param multicaster host event bus (nullable; null makes subscription a no-op)
     */
    public SubscriptionManager(ApplicationEventMulticaster multicaster) {
        this.multicaster = multicaster;
    }

    /** Subscribes {@code handler} unless a subscription is already active. */
    public synchronized void attach(TrackingEventHandler handler) {
        if (subscription != null || multicaster == null) {
            return;
        }
        Subscription s = new Subscription(new DataAccessListener(handler), new NotificationListener(handler));
        multicaster.addApplicationListener(s.dataAccess());
        multicaster.addApplicationListener(s.notifications());
        subscription = s;
        LOG.debug("Attached action tracker listeners");
    }

    /** Removes the active subscription, if any, so a later attach subscribes again. */
    public synchronized void detach() {
        if (subscription == null) {
            return;
        }
        multicaster.removeApplicationListener(subscription.dataAccess());
        multicaster.removeApplicationListener(subscription.notifications());
        subscription = null;
        LOG.debug("Detached action tracker listeners");
    }

    public synchronized boolean isAttached() {
        return subscription != null;
    }

    synchronized Optional<Subscription> currentSubscription() {
        return Optional.ofNullable(subscription);
    }

    record Subscription(ApplicationListener<ApplicationEvent> dataAccess,
                        ApplicationListener<ApplicationEvent> notifications) { }

    static final class DataAccessListener implements ApplicationListener<ApplicationEvent> {
        private final TrackingEventHandler handler;

        DataAccessListener(TrackingEventHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onApplicationEvent(ApplicationEvent event) {
            if (event instanceof PayloadApplicationEvent<?> p && p.getPayload() instanceof SqlStatementEvent e) {
                String sql = e.sql();
                if (sql != null && !sql.contains(SCHEMA_MARKER)) {
                    handler.onDataAccess(sql);
                }
            }
        }
    }

    static final class NotificationListener implements ApplicationListener<ApplicationEvent> {
        private final TrackingEventHandler handler;

        NotificationListener(TrackingEventHandler handler) {
            this.handler = handler;
        }

        @Override
        public void onApplicationEvent(ApplicationEvent event) {
            if (event instanceof PayloadApplicationEvent<?> p) {
                Object payload = p.getPayload();
                if (payload instanceof LifecycleEvent e) {
                    handler.onLifecycleEvent(e.name(), e.payload());
                } else if (!(payload instanceof SqlStatementEvent)) {
                    handler.onGenericEvent(payload.getClass().getSimpleName(), String.valueOf(payload));
                }
                return;
            }
            handler.onGenericEvent(event.getClass().getSimpleName(), event.toString());
        }
    }
}
