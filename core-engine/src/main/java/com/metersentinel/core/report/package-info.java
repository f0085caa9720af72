/**
 * Periodic consumption summaries (daily, weekly, monthly).
 *
 * @since 1.0.0
 */
package com.metersentinel.core.report;
