/**
 * Domain model: readings, reading windows and per-index anomaly verdicts.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.model;
