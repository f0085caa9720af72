/**
 * Unattended retraining: due check, training, evaluation, comparison and
 * promotion or rollback.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.lifecycle;
