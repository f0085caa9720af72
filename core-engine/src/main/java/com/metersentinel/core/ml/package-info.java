/**
 * Statistics helpers and the two model families: the seasonal forecaster and
 * the Random Cut Forest outlier model.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.ml;
