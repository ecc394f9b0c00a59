/**
 * Configuration loading and validation for the detection engine.
 *
 * <p>
 * {@link com.pfesentinel.core.config.ConfigLoader} reads YAML into a
 * {@link com.pfesentinel.core.config.DetectionConfig}: the exception-type
 * severity table, rule thresholds, baseline windows and dashboard settings.
 * Validation runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.pfesentinel.core.config;
