/**
 * Outbound collaborators for anomaly notifications, training results and
 * reports. Delivery mechanics live outside the core.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.notify;
