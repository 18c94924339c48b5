/**
 * Domain model for cutting-line analytics.
 *
 * <ul>
 * <li>{@link com.cutlinesight.core.model.DetectionEvent}: one normalized
 * detection</li>
 * <li>{@link com.cutlinesight.core.model.Session}: an immutable snapshot of
 * events</li>
 * <li>{@link com.cutlinesight.core.model.MinuteBucket},
 * {@link com.cutlinesight.core.model.SessionTotals} and
 * {@link com.cutlinesight.core.model.PeakWindow}: derived values, recomputed
 * for every query</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.model;
