/**
 * Domain model of a tracked unit of work.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.actiontracker.domain.TrackingContext} - mutable, thread-confined
 *       state collected while one request runs</li>
 *   <li>{@link com.phillippitts.actiontracker.domain.ActionSummary} - immutable snapshot handed to
 *       renderers and accumulators</li>
 *   <li>{@link com.phillippitts.actiontracker.domain.AccessMode} - {@code R}/{@code W}/{@code RW}
 *       cell codes</li>
 * </ul>
 *
 * <p>Nothing in this package depends on Spring or Log4j.
 *
 * @since 1.0
 */
package com.phillippitts.actiontracker.domain;
