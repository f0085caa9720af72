/**
 * Error taxonomy shared by the detection engine, the trainer, the registry and
 * the lifecycle manager.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.error;
