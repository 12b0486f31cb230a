/**
 * PostgreSQL {@code EXPLAIN ANALYZE} analysis package.
 *
 * <p>
 * {@link io.github.yok.dataporter.explain.PlanLineParser} classifies report lines,
 * {@link io.github.yok.dataporter.explain.TimelineBuilder} assembles them into a
 * {@link io.github.yok.dataporter.explain.PlanSummary} during a reverse scan, and
 * {@link io.github.yok.dataporter.explain.TimelineChartRenderer} draws the summary as a timeline
 * image.
 * </p>
 */
package io.github.yok.dataporter.explain;
