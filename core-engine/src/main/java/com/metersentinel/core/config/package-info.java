/**
 * YAML configuration model and loader.
 *
 * <p>
 * {@link com.metersentinel.core.config.ConfigLoader} resolves and parses
 * {@code meter-sentinel.yml} into
 * {@link com.metersentinel.core.config.SentinelConfig}, whose sections hold
 * the detector, classification, severity, validation, training, registry and
 * job-schedule parameters.
 * </p>
 *
 * @since 1.0.0
 */
package com.metersentinel.core.config;
