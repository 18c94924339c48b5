/**
 * Event filters applied between the session and its derived views.
 *
 * <p>
 * A {@link com.cutlinesight.core.filter.TimeRangeFilter}, picked by
 * {@link com.cutlinesight.core.filter.TimeRangeFilters}, narrows the session
 * first. Its output feeds the bucket aggregation and, independently, the
 * {@link com.cutlinesight.core.filter.DisplayFilter}.
 * </p>
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.filter;
