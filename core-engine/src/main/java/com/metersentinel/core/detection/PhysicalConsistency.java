package com.metersentinel.core.detection;

import com.metersentinel.core.model.Reading;

/**
 * Checks a reading against the relation {@code I ≈ P / V}.
 *
 * @since 1.0.0
 */
public final class PhysicalConsistency {

    /** Currents below this are treated as this value when comparing. */
    static final double MIN_CURRENT_A = 0.1;

    private PhysicalConsistency() {
        // utility class, not instantiable
    }

    /**
     * Compare the measured current with the current derived from active power
     * and voltage.
     *
     * @param reading   reading to check
     * @param tolerance maximum relative difference
     * @return {@code true} if the difference exceeds {@code tolerance}; a
     *         reading without measured current or voltage cannot violate it
     */
    public static boolean violatesPowerLaw(Reading reading, double tolerance) {
        double voltage = reading.getVoltage();
        double measured = reading.getCurrentA();
        if (!Double.isFinite(voltage) || voltage <= 0 || !Double.isFinite(measured)) {
            return false;
        }
        double derived = reading.getActivePowerKw() * 1000.0 / voltage;
        double scale = Math.max(Math.max(Math.abs(derived), Math.abs(measured)), MIN_CURRENT_A);
        return Math.abs(derived - measured) / scale > tolerance;
    }

    /**
     * @return {@code true} if the voltage is known and outside {@code [min, max]}
     */
    public static boolean voltageOutside(Reading reading, double min, double max) {
        double voltage = reading.getVoltage();
        return Double.isFinite(voltage) && (voltage < min || voltage > max);
    }
}
