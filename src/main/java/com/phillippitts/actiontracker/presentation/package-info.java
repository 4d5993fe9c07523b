/**
 * Servlet and Spring MVC adapters that drive the tracker.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.filter} - wraps each request in begin/flush/end</li>
 *   <li>{@code presentation.interceptor} - publishes {@code process_action} and
 *       {@code render_template} lifecycle events</li>
 * </ul>
 *
 * <p>The filter runs outside the dispatcher and the interceptor inside it, so the action identity
 * is always recorded after the unit of work has begun.
 *
 * @see com.phillippitts.actiontracker.service.tracker.ActionTracker
 * @since 1.0
 */
package com.phillippitts.actiontracker.presentation;
