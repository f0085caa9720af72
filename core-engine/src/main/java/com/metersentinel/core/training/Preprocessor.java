package com.metersentinel.core.training;

import com.metersentinel.core.config.ClassificationSettings;
import com.metersentinel.core.config.TrainingSettings;
import com.metersentinel.core.error.DataQualityException;
import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.Reading;
import com.metersentinel.core.model.ReadingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cleans a validated training window.
 *
 * <ol>
 * <li>Forward fill, then backward fill, missing power, voltage and
 * current.</li>
 * <li>Clip power to wide IQR fences ({@code clipMultiplier}, far wider than
 * the detection fences) so a few spikes cannot drag the trend.</li>
 * <li>Clamp every measurement into its physical range.</li>
 * </ol>
 *
 * <p>
 * Timestamps and order are untouched. Temporal features (hour of day, day of
 * week) are derived from timestamps by the models themselves.
 * </p>
 *
 * @since 1.0.0
 */
public class Preprocessor {

    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final TrainingSettings training;
    private final ClassificationSettings bounds;

    public Preprocessor(TrainingSettings training, ClassificationSettings bounds) {
        this.training = Objects.requireNonNull(training, "TrainingSettings must not be null");
        this.bounds = Objects.requireNonNull(bounds, "ClassificationSettings must not be null");
    }

    /**
     * @param window validated window
     * @return cleaned window with the same bounds and timestamps
     * @throws DataQualityException if a measurement is missing in every reading
     */
    public ReadingWindow clean(ReadingWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        List<Reading> readings = window.getReadings();
        int n = readings.size();
        double[] power = new double[n];
        double[] voltage = new double[n];
        double[] current = new double[n];
        for (int i = 0; i < n; i++) {
            Reading r = readings.get(i);
            power[i] = r.getActivePowerKw();
            voltage[i] = r.getVoltage();
            current[i] = r.getCurrentA();
        }

        int filled = fill(power, "active power") + fill(voltage, "voltage") + fill(current, "current");

        double[] fences = Statistics.iqrFences(power, training.getClipMultiplier());
        int clipped = 0;
        for (int i = 0; i < n; i++) {
            double v = clamp(power[i], fences[0], fences[1]);
            v = clamp(v, 0.0, bounds.getMaxPlausiblePowerKw());
            if (v != power[i]) {
                clipped++;
            }
            power[i] = v;
            voltage[i] = clamp(voltage[i], bounds.getPlausibleVoltageMin(), bounds.getPlausibleVoltageMax());
            current[i] = Math.max(0.0, current[i]);
        }

        List<Reading> cleaned = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            cleaned.add(readings.get(i).toBuilder()
                    .activePowerKw(power[i])
                    .voltage(voltage[i])
                    .currentA(current[i])
                    .build());
        }
        LOG.info("Preprocessed {} reading(s): {} value(s) filled, {} power value(s) clipped", n, filled, clipped);
        return window.withReadings(cleaned);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static int fill(double[] values, String name) {
        int filled = 0;
        double last = Double.NaN;
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                if (!Double.isNaN(last)) {
                    values[i] = last;
                    filled++;
                }
            } else {
                last = values[i];
            }
        }
        if (values.length > 0 && Double.isNaN(last)) {
            throw new DataQualityException("No " + name + " values present in the training window");
        }
        double next = Double.NaN;
        for (int i = values.length - 1; i >= 0; i--) {
            if (Double.isNaN(values[i])) {
                values[i] = next;
                filled++;
            } else {
                next = values[i];
            }
        }
        return filled;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
