package com.phillippitts.actiontracker.presentation.interceptor;

import com.phillippitts.actiontracker.service.subscription.event.LifecycleEvent;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.ModelAndView;

/**
 * Publishes Spring MVC lifecycle events for the action tracker.
 *
 * <p>{@code process_action} is published before a {@link HandlerMethod} runs, carrying the bean's
 * simple class name and the method name; {@code render_template} is published after the handler
 * returns a view name.
 */
public class ActionLifecycleInterceptor implements HandlerInterceptor {

    private final ApplicationEventPublisher publisher;

    public ActionLifecycleInterceptor(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (handler instanceof HandlerMethod method) {
            publisher.publishEvent(LifecycleEvent.actionStarted(
                    method.getBeanType().getSimpleName(),
                    method.getMethod().getName()));
        }
        return true;
    }

    @Override
    public void postHandle(HttpServletRequest request, HttpServletResponse response, Object handler,
                           ModelAndView modelAndView) {
        if (modelAndView != null && modelAndView.getViewName() != null) {
            publisher.publishEvent(LifecycleEvent.templateRendered(modelAndView.getViewName()));
        }
    }
}
