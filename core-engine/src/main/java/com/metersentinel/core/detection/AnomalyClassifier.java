package com.metersentinel.core.detection;

import com.metersentinel.core.config.ClassificationSettings;
import com.metersentinel.core.ml.Statistics;
import com.metersentinel.core.model.AnomalyCategory;
import com.metersentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;

/**
 * Assigns an {@link AnomalyCategory} to confirmed anomalies with a
 * priority-ordered rule table.
 *
 * <h3>Rules, first match wins</h3>
 * <ol>
 * <li>{@code sensor_fault}: measured current disagrees with
 * {@code P / V}, or voltage is outside the nominal band. Checked first
 * because it invalidates the readings the other rules look at.</li>
 * <li>{@code high_consumption}: power at or above the absolute high
 * threshold, or above the window's high quantile.</li>
 * <li>{@code low_consumption}: power at or below the absolute low threshold
 * or below the window's low quantile, for at least
 * {@code lowSustainedReadings} consecutive readings.</li>
 * <li>{@code transient}: everything else.</li>
 * </ol>
 *
 * <p>
 * The last rule always matches, so every confirmed anomaly gets a category.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyClassifier {

    private final ClassificationSettings settings;
    private final List<Rule> rules;

    public AnomalyClassifier(ClassificationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "ClassificationSettings must not be null");
        this.rules = List.of(
                new Rule(AnomalyCategory.SENSOR_FAULT, this::isSensorFault),
                new Rule(AnomalyCategory.HIGH_CONSUMPTION, this::isHigh),
                new Rule(AnomalyCategory.LOW_CONSUMPTION, this::isSustainedLow),
                new Rule(AnomalyCategory.TRANSIENT, (window, i) -> true));
    }

    /**
     * Prepare window-level thresholds once per detection run.
     *
     * @param readings plausible readings of the window
     * @return window bound to this classifier's rules
     */
    public ClassifiedWindow prepare(List<Reading> readings) {
        return new ClassifiedWindow(readings);
    }

    /**
     * @return categories in evaluation order
     */
    public List<AnomalyCategory> ruleOrder() {
        return rules.stream().map(r -> r.category).toList();
    }

    // ---------------------------------------------------------------
    // Rule predicates
    // ---------------------------------------------------------------

    private boolean isSensorFault(ClassifiedWindow window, int i) {
        Reading reading = window.readings.get(i);
        return PhysicalConsistency.violatesPowerLaw(reading, settings.getCurrentToleranceRatio())
                || PhysicalConsistency.voltageOutside(reading,
                        settings.getNominalVoltageMin(), settings.getNominalVoltageMax());
    }

    private boolean isHigh(ClassifiedWindow window, int i) {
        double v = window.values[i];
        return v >= settings.getHighAbsoluteKw() || v > window.highThreshold;
    }

    private boolean isSustainedLow(ClassifiedWindow window, int i) {
        if (!window.isLow(i)) {
            return false;
        }
        int run = 1;
        for (int j = i - 1; j >= 0 && window.isLow(j); j--) {
            run++;
        }
        for (int j = i + 1; j < window.values.length && window.isLow(j); j++) {
            run++;
        }
        return run >= settings.getLowSustainedReadings();
    }

    // ---------------------------------------------------------------
    // Nested types
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface RulePredicate {
        boolean test(ClassifiedWindow window, int index);
    }

    private static final class Rule {
        private final AnomalyCategory category;
        private final RulePredicate predicate;

        private Rule(AnomalyCategory category, RulePredicate predicate) {
            this.category = category;
            this.predicate = predicate;
        }
    }

    /**
     * A window with its quantile thresholds computed, ready to classify
     * individual indices.
     */
    public final class ClassifiedWindow {

        private final List<Reading> readings;
        private final double[] values;
        private final double highThreshold;
        private final double lowThreshold;

        private ClassifiedWindow(List<Reading> readings) {
            this.readings = readings;
            this.values = new double[readings.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = readings.get(i).getActivePowerKw();
            }
            double[] sorted = Statistics.sortedFinite(values);
            this.highThreshold = Statistics.quantileOfSorted(sorted, settings.getHighQuantile());
            this.lowThreshold = Statistics.quantileOfSorted(sorted, settings.getLowQuantile());
        }

        /**
         * @param index position in the window
         * @return the first matching category
         */
        public AnomalyCategory classify(int index) {
            for (Rule rule : rules) {
                if (rule.predicate.test(this, index)) {
                    return rule.category;
                }
            }
            // unreachable: the transient rule matches everything
            return AnomalyCategory.TRANSIENT;
        }

        private boolean isLow(int i) {
            double v = values[i];
            return v <= settings.getLowAbsoluteKw() || v < lowThreshold;
        }
    }
}
