/**
 * Reading source abstraction consumed by the jobs and the lifecycle manager.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.source;
