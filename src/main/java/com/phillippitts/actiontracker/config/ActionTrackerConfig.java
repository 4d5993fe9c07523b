package com.phillippitts.actiontracker.config;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import com.phillippitts.actiontracker.presentation.filter.ActionTrackerFilter;
import com.phillippitts.actiontracker.presentation.filter.TrackingRequestPolicy;
import com.phillippitts.actiontracker.presentation.interceptor.ActionLifecycleInterceptor;
import com.phillippitts.actiontracker.service.metrics.TrackerMetrics;
import com.phillippitts.actiontracker.service.render.OutputFormat;
import com.phillippitts.actiontracker.service.sink.FileLogSummarySink;
import com.phillippitts.actiontracker.service.sink.LoggerSummarySink;
import com.phillippitts.actiontracker.service.sink.SummarySink;
import com.phillippitts.actiontracker.service.subscription.SubscriptionManager;
import com.phillippitts.actiontracker.service.tracker.ActionTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ApplicationEventMulticaster;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Auto-configuration for the action tracker.
 *
 * <p>Wires the tracker from {@link ActionTrackerProperties} ({@code action-tracker.*}). In servlet
 * web applications it also registers {@link ActionTrackerFilter} and
 * {@link ActionLifecycleInterceptor}. Hosts publish
 * {@link com.phillippitts.actiontracker.service.subscription.event.SqlStatementEvent} from their
 * data-access layer.
 *
 * <p>Micrometer: the host's {@link MeterRegistry} is used when present, otherwise a private
 * {@link SimpleMeterRegistry}.
 */
@AutoConfiguration
@EnableConfigurationProperties(ActionTrackerProperties.class)
public class ActionTrackerConfig {

    /** Runs right after request-correlation filters so tracker logs carry the request id. */
    static final int FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    @Bean
    ActionTrackerConfigurationValidator actionTrackerConfigurationValidator(ActionTrackerProperties props) {
        return new ActionTrackerConfigurationValidator(props);
    }

    @Bean
    @ConditionalOnMissingBean
    TrackerMetrics trackerMetrics(ObjectProvider<MeterRegistry> registry) {
        return new TrackerMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    SubscriptionManager actionTrackerSubscriptionManager(ObjectProvider<ApplicationEventMulticaster> multicaster) {
        return new SubscriptionManager(multicaster.getIfAvailable());
    }

    /**
     * File channel for table output. Only backed by a real file when file output is active and the
     * log format is not accumulated.
     */
    @Bean
    SummarySink actionTrackerFileSink(ActionTrackerProperties props) {
        if (props.isFileOutputActive() && props.getLogFormat() == OutputFormat.TABLE) {
            return new FileLogSummarySink(props.getLogFilePath());
        }
        return SummarySink.DISCARD;
    }

    @Bean
    @ConditionalOnMissingBean
    ActionTracker actionTracker(ActionTrackerProperties props,
                                SubscriptionManager subscriptions,
                                SummarySink actionTrackerFileSink,
                                TrackerMetrics metrics) {
        return new ActionTracker(props, subscriptions, new LoggerSummarySink(), actionTrackerFileSink, metrics);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class WebConfig implements WebMvcConfigurer {

        private final ApplicationEventPublisher publisher;

        WebConfig(ApplicationEventPublisher publisher) {
            this.publisher = publisher;
        }

        @Bean
        FilterRegistrationBean<ActionTrackerFilter> actionTrackerFilter(ActionTracker tracker,
                                                                        ActionTrackerProperties props) {
            FilterRegistrationBean<ActionTrackerFilter> registration =
                    new FilterRegistrationBean<>(new ActionTrackerFilter(tracker, new TrackingRequestPolicy(props)));
            registration.setOrder(FILTER_ORDER);
            registration.addUrlPatterns("/*");
            return registration;
        }

        @Override
        public void addInterceptors(InterceptorRegistry registry) {
            registry.addInterceptor(new ActionLifecycleInterceptor(publisher));
        }
    }
}
