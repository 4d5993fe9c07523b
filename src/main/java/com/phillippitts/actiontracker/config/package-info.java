/**
 * Spring Boot auto-configuration and startup validation for the action tracker.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.actiontracker.config.ActionTrackerConfig} - registers the tracker,
 *       its sinks, metrics, the request filter and the MVC lifecycle interceptor</li>
 *   <li>{@link com.phillippitts.actiontracker.config.properties.ActionTrackerProperties} - typed
 *       {@code action-tracker.*} properties</li>
 * </ul>
 *
 * <p>Example {@code application.yml}:
 * <pre>
 * action-tracker:
 *   print-format: table
 *   log-format: json
 *   write-to-file: true
 *   log-file-path: log/action_tracker.json
 *   ignored-controllers: [HealthController]
 *   ignored-actions:
 *     "[*]": [ping]
 *   services:
 *     - name: Elasticsearch
 *       pattern: "(?i)elasticsearch"
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.actiontracker.config;
