package com.metersentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single meter reading.
 *
 * <p>
 * Units follow the household power dataset the system was built around:
 * active power in kilowatts, voltage in volts, current in amperes and
 * sub-metering channels in watt-hours. A measurement that was not captured is
 * represented as {@link Double#NaN}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #builder()} or {@link #of(Instant, double, double, double)}.
 * Instances are immutable; {@link #toBuilder()} derives a modified copy.
 * </p>
 *
 * @since 1.0.0
 */
public final class Reading {

    private final Instant timestamp;
    private final double activePowerKw;
    private final double voltage;
    private final double currentA;
    private final double subMetering1;
    private final double subMetering2;
    private final double subMetering3;

    private Reading(Builder b) {
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.activePowerKw = b.activePowerKw;
        this.voltage = b.voltage;
        this.currentA = b.currentA;
        this.subMetering1 = b.subMetering1;
        this.subMetering2 = b.subMetering2;
        this.subMetering3 = b.subMetering3;
    }

    /**
     * Convenience factory for readings without sub-metering data.
     */
    public static Reading of(Instant timestamp, double activePowerKw, double voltage, double currentA) {
        return builder()
                .timestamp(timestamp)
                .activePowerKw(activePowerKw)
                .voltage(voltage)
                .currentA(currentA)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .timestamp(timestamp)
                .activePowerKw(activePowerKw)
                .voltage(voltage)
                .currentA(currentA)
                .subMetering1(subMetering1)
                .subMetering2(subMetering2)
                .subMetering3(subMetering3);
    }

    // ---------------------------------------------------------------
    // Physical checks
    // ---------------------------------------------------------------

    /**
     * Check that the reading could have come from a working meter.
     *
     * <p>
     * Negative or non-finite power, power above {@code maxPowerKw}, and voltage
     * outside {@code [minVoltage, maxVoltage]} are data-quality defects. Such a
     * reading is excluded from anomaly voting.
     * </p>
     *
     * @param minVoltage lowest plausible voltage
     * @param maxVoltage highest plausible voltage
     * @param maxPowerKw highest plausible active power
     * @return {@code true} if the reading is plausible
     */
    public boolean isPhysicallyPlausible(double minVoltage, double maxVoltage, double maxPowerKw) {
        if (!Double.isFinite(activePowerKw) || activePowerKw < 0 || activePowerKw > maxPowerKw) {
            return false;
        }
        return Double.isFinite(voltage) && voltage >= minVoltage && voltage <= maxVoltage;
    }

    /**
     * @return {@code true} if any of power, voltage or current is missing
     */
    public boolean hasMissingValues() {
        return Double.isNaN(activePowerKw) || Double.isNaN(voltage) || Double.isNaN(currentA);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getActivePowerKw() {
        return activePowerKw;
    }

    public double getVoltage() {
        return voltage;
    }

    public double getCurrentA() {
        return currentA;
    }

    public double getSubMetering1() {
        return subMetering1;
    }

    public double getSubMetering2() {
        return subMetering2;
    }

    public double getSubMetering3() {
        return subMetering3;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Reading}. Only {@code timestamp} is required;
     * unset measurements default to {@link Double#NaN} except sub-metering,
     * which defaults to zero.
     */
    public static class Builder {
        private Instant timestamp;
        private double activePowerKw = Double.NaN;
        private double voltage = Double.NaN;
        private double currentA = Double.NaN;
        private double subMetering1;
        private double subMetering2;
        private double subMetering3;

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder activePowerKw(double activePowerKw) {
            this.activePowerKw = activePowerKw;
            return this;
        }

        public Builder voltage(double voltage) {
            this.voltage = voltage;
            return this;
        }

        public Builder currentA(double currentA) {
            this.currentA = currentA;
            return this;
        }

        public Builder subMetering1(double subMetering1) {
            this.subMetering1 = subMetering1;
            return this;
        }

        public Builder subMetering2(double subMetering2) {
            this.subMetering2 = subMetering2;
            return this;
        }

        public Builder subMetering3(double subMetering3) {
            this.subMetering3 = subMetering3;
            return this;
        }

        /**
         * @return a new {@link Reading}
         * @throws NullPointerException if {@code timestamp} is {@code null}
         */
        public Reading build() {
            return new Reading(this);
        }
    }

    // ---------------------------------------------------------------
    // Object overrides
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Reading that)) {
            return false;
        }
        return Double.compare(activePowerKw, that.activePowerKw) == 0
                && Double.compare(voltage, that.voltage) == 0
                && Double.compare(currentA, that.currentA) == 0
                && Double.compare(subMetering1, that.subMetering1) == 0
                && Double.compare(subMetering2, that.subMetering2) == 0
                && Double.compare(subMetering3, that.subMetering3) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, activePowerKw, voltage, currentA,
                subMetering1, subMetering2, subMetering3);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "timestamp=" + timestamp +
                ", activePowerKw=" + activePowerKw +
                ", voltage=" + voltage +
                ", currentA=" + currentA +
                '}';
    }
}
