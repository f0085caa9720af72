/**
 * Training pipeline: data-quality validation, cleaning, fitting and
 * holdout evaluation.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.training;
