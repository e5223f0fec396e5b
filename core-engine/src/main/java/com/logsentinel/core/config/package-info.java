/**
 * Configuration loading and validation.
 *
 * <p>
 * The configuration is defined in YAML and loaded by
 * {@link com.logsentinel.core.config.ConfigLoader} into a
 * {@link com.logsentinel.core.config.SentinelConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.logsentinel.core.config;
