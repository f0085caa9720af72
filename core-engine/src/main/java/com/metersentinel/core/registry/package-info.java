/**
 * Versioned model storage, production pointers and the metrics history.
 *
 * @since 1.0.0
 */
package com.metersentinel.core.registry;
