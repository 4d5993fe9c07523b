package com.phillippitts.actiontracker.service.tracker;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import com.phillippitts.actiontracker.domain.ActionIdentity;
import com.phillippitts.actiontracker.domain.ActionSummary;
import com.phillippitts.actiontracker.domain.TrackingContext;
import com.phillippitts.actiontracker.exception.AccumulationException;
import com.phillippitts.actiontracker.service.accumulate.CsvFileAccumulator;
import com.phillippitts.actiontracker.service.accumulate.JsonFileAccumulator;
import com.phillippitts.actiontracker.service.accumulate.SummaryAccumulator;
import com.phillippitts.actiontracker.service.classify.ServiceDetector;
import com.phillippitts.actiontracker.service.classify.StatementClassifier;
import com.phillippitts.actiontracker.service.context.TrackingContextStore;
import com.phillippitts.actiontracker.service.metrics.TrackerMetrics;
import com.phillippitts.actiontracker.service.policy.IgnorePolicy;
import com.phillippitts.actiontracker.service.render.OutputFormat;
import com.phillippitts.actiontracker.service.render.RenderedOutput;
import com.phillippitts.actiontracker.service.render.SummaryRenderers;
import com.phillippitts.actiontracker.service.sink.SummarySink;
import com.phillippitts.actiontracker.service.subscription.SubscriptionManager;
import com.phillippitts.actiontracker.service.subscription.TrackingEventHandler;
import com.phillippitts.actiontracker.service.subscription.event.LifecycleEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks table access and service usage for one unit of work at a time per thread.
 *
 * <p>Hosts call {@link #begin()}, {@link #flush()} and {@link #end()} around each request; the
 * three are independently callable so any request-filtering policy can wrap them. {@code end()}
 * belongs in a {@code finally} block.
 *
 * <p>On {@code flush()} the tracker applies the ignore policy, renders the print channel with
 * {@link ActionTrackerProperties#getPrintFormat()} and the file channel with
 * {@link ActionTrackerProperties#getLogFormat()}. JSON and CSV file output is merged into the
 * accumulation file; table output is appended through the file sink. Accumulation failures are
 * logged and never reach the caller.
 *
 * <p><b>Thread Safety:</b> contexts are thread-confined. Listener attachment is shared: the
 * listeners stay attached while at least one unit of work is active, so one request ending does
 * not unsubscribe another that is still running.
 */
public class ActionTracker implements TrackingEventHandler {

    private static final Logger LOG = LogManager.getLogger(ActionTracker.class);

    static final String OUTCOME_RENDERED = "rendered";
    static final String OUTCOME_IGNORED = "ignored";
    static final String OUTCOME_INACTIVE = "inactive";

    private final ActionTrackerProperties properties;
    private final TrackingContextStore store;
    private final StatementClassifier classifier;
    private final ServiceDetector serviceDetector;
    private final IgnorePolicy ignorePolicy;
    private final SubscriptionManager subscriptions;
    private final SummarySink printSink;
    private final SummarySink fileSink;
    private final Map<OutputFormat, SummaryAccumulator> accumulators = new EnumMap<>(OutputFormat.class);
    private final TrackerMetrics metrics;

    private final Object attachmentLock = new Object();
    private int activeUnits;

    /**
     * @param properties    tracker configuration
     * @param subscriptions event bus subscription (its multicaster may be absent)
     * @param printSink     print channel
     * @param fileSink      file channel for table output ({@link SummarySink#DISCARD} when unused)
     * @param metrics       tracker instrumentation
     */
    public ActionTracker(ActionTrackerProperties properties,
                         SubscriptionManager subscriptions,
                         SummarySink printSink,
                         SummarySink fileSink,
                         TrackerMetrics metrics) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions must not be null");
        this.printSink = printSink == null ? SummarySink.DISCARD : printSink;
        this.fileSink = fileSink == null ? SummarySink.DISCARD : fileSink;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.store = new TrackingContextStore();
        this.ignorePolicy = IgnorePolicy.from(properties);
        this.classifier = new StatementClassifier(ignorePolicy);
        this.serviceDetector = ServiceDetector.from(properties);
        register(new JsonFileAccumulator());
        register(new CsvFileAccumulator());
    }

    private void register(SummaryAccumulator accumulator) {
        accumulators.put(accumulator.format(), accumulator);
    }

    /**
     * Starts a unit of work on the calling thread and attaches listeners if needed.
     * A context left over from an earlier unit that never ended is replaced.
     */
    public void begin() {
        boolean replaced = store.begin();
        if (replaced) {
            LOG.debug("Replacing tracking context that was never ended");
            metrics.incrementStaleContext();
            return;
        }
        synchronized (attachmentLock) {
            activeUnits++;
            subscriptions.attach(this);
        }
    }

    /**
     * Ends the unit of work on the calling thread. Never fails.
     *
     * @return the captured context, or an empty context if none was active
     */
    public TrackingContext end() {
        boolean wasActive = store.isActive();
        TrackingContext ctx = store.clear();
        if (wasActive) {
            synchronized (attachmentLock) {
                activeUnits = Math.max(0, activeUnits - 1);
                if (activeUnits == 0) {
                    subscriptions.detach();
                }
            }
        }
        return ctx;
    }

    /**
     * Renders and writes the current unit of work's summary to the configured channels.
     * Does nothing without an active context or when the action is ignored.
     */
    public void flush() {
        Optional<TrackingContext> current = store.current();
        if (current.isEmpty()) {
            metrics.incrementFlush(OUTCOME_INACTIVE);
            return;
        }
        TrackingContext ctx = current.get();
        Optional<ActionIdentity> identity = ctx.actionIdentity();
        if (identity.isPresent() && ignorePolicy.shouldIgnore(identity.get().controller(), identity.get().action())) {
            LOG.debug("Skipping summary for ignored action {}", identity.get().label());
            metrics.incrementFlush(OUTCOME_IGNORED);
            return;
        }

        ActionSummary summary = summarize(ctx);

        if (properties.isPrintToLog()) {
            RenderedOutput printed = SummaryRenderers.forFormat(properties.getPrintFormat()).render(summary);
            printSink.write(printed.select(properties.isColorize()));
        }

        if (properties.isFileOutputActive()) {
            OutputFormat logFormat = properties.getLogFormat();
            if (logFormat.isAccumulated()) {
                accumulate(logFormat, properties.getLogFilePath(), summary);
            } else {
                fileSink.write(SummaryRenderers.forFormat(logFormat).render(summary).plain());
            }
        }
        metrics.incrementFlush(OUTCOME_RENDERED);
    }

    /** Builds the summary of {@code ctx} without rendering it. */
    public ActionSummary summarize(TrackingContext ctx) {
        List<String> services = new ArrayList<>(serviceDetector.detectServices(ctx.capturedLines()));
        String label = ctx.actionIdentity().map(ActionIdentity::label).orElse(null);
        return ActionSummary.of(ctx.readTables(), ctx.writeTables(), services, label);
    }

    private void accumulate(OutputFormat format, Path file, ActionSummary summary) {
        SummaryAccumulator accumulator = accumulators.get(format);
        long start = System.nanoTime();
        try {
            accumulator.accumulate(file, summary);
            metrics.recordAccumulation(format.name().toLowerCase(Locale.ROOT), System.nanoTime() - start);
        } catch (AccumulationException e) {
            LOG.error("Failed to accumulate {} data for {}: {}", format, summary.labelOrUnknown(), e.getMessage(), e);
            metrics.incrementAccumulationFailure(format.name().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Records a statement for the calling thread's unit of work. Ignored without an active
     * context or when the statement names no tracked table.
     */
    @Override
    public void onDataAccess(String sql) {
        store.current().ifPresent(ctx -> classifier.classify(sql).ifPresent(ctx::record));
    }

    /**
     * Records a lifecycle event for the calling thread's unit of work. The first
     * {@value LifecycleEvent#ACTION_STARTED} event sets the action identity.
     */
    @Override
    public void onLifecycleEvent(String name, Map<String, Object> payload) {
        Optional<TrackingContext> current = store.current();
        if (current.isEmpty() || name == null) {
            return;
        }
        TrackingContext ctx = current.get();
        Map<String, Object> data = payload == null ? Map.of() : payload;
        if (LifecycleEvent.ACTION_STARTED.equals(name)) {
            Object controller = data.get(LifecycleEvent.CONTROLLER);
            Object action = data.get(LifecycleEvent.ACTION);
            if (controller != null && action != null) {
                ctx.identify(new ActionIdentity(controller.toString(), action.toString()));
            }
        }
        ctx.captureLine(describe(name, data));
    }

    /** Captures the event's string form for service detection. Ignored without an active context. */
    @Override
    public void onGenericEvent(String name, String message) {
        store.current().ifPresent(ctx -> ctx.captureLine(message));
    }

    static String describe(String name, Map<String, Object> payload) {
        switch (name) {
            case LifecycleEvent.ACTION_STARTED:
                return "Controller: " + payload.get(LifecycleEvent.CONTROLLER) + '#' + payload.get(LifecycleEvent.ACTION);
            case LifecycleEvent.TEMPLATE_RENDERED:
                return "Template: " + payload.get(LifecycleEvent.IDENTIFIER);
            default:
                return payload.toString();
        }
    }

    /** The calling thread's context, if a unit of work is active. */
    public Optional<TrackingContext> currentContext() {
        return store.current();
    }

    public ActionTrackerProperties getProperties() {
        return properties;
    }
}
