/**
 * Text renderers for action summaries.
 *
 * <p>Each {@link com.phillippitts.actiontracker.service.render.SummaryRenderer} produces a coloured
 * and a plain variant; only the table format uses colour. Empty summaries render
 * {@value com.phillippitts.actiontracker.service.render.SummaryRenderer#EMPTY_MESSAGE}.
 */
package com.phillippitts.actiontracker.service.render;
