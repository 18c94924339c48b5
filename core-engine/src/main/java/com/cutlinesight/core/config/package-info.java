/**
 * Configuration loading and validation.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.cutlinesight.core.config.AnalyticsConfigLoader} into an
 * {@link com.cutlinesight.core.config.AnalyticsConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.cutlinesight.core.config;
