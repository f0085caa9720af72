package com.metersentinel.core;

import com.metersentinel.core.ml.OutlierModel;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reading fixtures shared by the core tests.
 */
public final class TestReadings {

    /** A Monday, midnight UTC. */
    public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    public static final double VOLTAGE = 230.0;

    private TestReadings() {
    }

    /**
     * Reading at {@code START + minute} with a current consistent with
     * {@code kw} at {@link #VOLTAGE}.
     */
    public static Reading at(int minute, double kw) {
        return Reading.of(START.plus(Duration.ofMinutes(minute)), kw, VOLTAGE, kw * 1000.0 / VOLTAGE);
    }

    public static ReadingWindow minutely(double... kw) {
        List<Reading> readings = new ArrayList<>(kw.length);
        for (int i = 0; i < kw.length; i++) {
            readings.add(at(i, kw[i]));
        }
        return new ReadingWindow(START, START.plus(Duration.ofMinutes(kw.length)), readings);
    }

    /**
     * {@code n} values alternating between 1.0 and 1.1 kW.
     */
    public static double[] steady(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i % 2 == 0 ? 1.0 : 1.1;
        }
        return values;
    }

    /**
     * Hourly readings over {@code days} days with a daily load cycle.
     */
    public static List<Reading> hourlyPattern(int days) {
        List<Reading> readings = new ArrayList<>(days * 24);
        for (int i = 0; i < days * 24; i++) {
            int hour = i % 24;
            double kw = 1.0 + 0.5 * Math.sin(2 * Math.PI * hour / 24.0) + (i % 7) * 0.01;
            readings.add(Reading.builder()
                    .timestamp(START.plus(Duration.ofHours(i)))
                    .activePowerKw(kw)
                    .voltage(VOLTAGE + (i % 5))
                    .currentA(kw * 1000.0 / VOLTAGE)
                    .subMetering1(1.0)
                    .subMetering2(2.0)
                    .subMetering3(3.0)
                    .build());
        }
        return readings;
    }

    /**
     * Outlier model whose score is the reading's active power.
     */
    public static OutlierModel powerAbove(double thresholdKw) {
        return new OutlierModel() {
            @Override
            public double score(Reading reading) {
                return reading.getActivePowerKw();
            }

            @Override
            public double getThreshold() {
                return thresholdKw;
            }
        };
    }
}
