package com.phillippitts.actiontracker.presentation.filter;

import com.phillippitts.actiontracker.config.properties.ActionTrackerProperties;
import com.phillippitts.actiontracker.service.tracker.ActionTracker;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ActionTrackerFilterTest {

    private ActionTracker tracker;
    private ActionTrackerFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        tracker = mock(ActionTracker.class);
        filter = new ActionTrackerFilter(tracker, new TrackingRequestPolicy(ActionTrackerProperties.defaults()));
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
    }

    @Test
    void wrapsRequestInUnitOfWork() throws ServletException, IOException {
        when(request.getRequestURI()).thenReturn("/users/1");

        filter.doFilter(request, response, chain);

        InOrder order = inOrder(tracker, chain);
        order.verify(tracker).begin();
        order.verify(chain).doFilter(request, response);
        order.verify(tracker).flush();
        order.verify(tracker).end();
    }

    @Test
    void endsButDoesNotFlushWhenChainFails() throws ServletException, IOException {
        when(request.getRequestURI()).thenReturn("/users/1");
        doThrow(new ServletException("boom")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        verify(tracker).begin();
        verify(tracker, never()).flush();
        verify(tracker).end();
    }

    @Test
    void flushFailureDoesNotFailRequest() throws ServletException, IOException {
        when(request.getRequestURI()).thenReturn("/users/1");
        when(request.getMethod()).thenReturn("GET");
        doThrow(new IllegalStateException("render failed")).when(tracker).flush();

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verify(tracker).end();
    }

    @Test
    void excludedPathsPassThroughUntracked() throws ServletException, IOException {
        when(request.getRequestURI()).thenReturn("/assets/app.js");

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verifyNoInteractions(tracker);
    }

    @Test
    void disabledTrackerPassesThrough() throws ServletException, IOException {
        filter = new ActionTrackerFilter(tracker,
                new TrackingRequestPolicy(ActionTrackerProperties.builder().enabled(false).build()));
        when(request.getRequestURI()).thenReturn("/users/1");

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verifyNoInteractions(tracker);
    }

    @Test
    void nonHttpRequestsPassThrough() throws ServletException, IOException {
        ServletRequest plainRequest = mock(ServletRequest.class);
        ServletResponse plainResponse = mock(ServletResponse.class);

        filter.doFilter(plainRequest, plainResponse, chain);

        verify(chain).doFilter(plainRequest, plainResponse);
        verifyNoInteractions(tracker);
    }
}
