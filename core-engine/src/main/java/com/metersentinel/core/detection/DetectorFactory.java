package com.metersentinel.core.detection;

import com.metersentinel.core.config.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates the standard set of five {@link WindowDetector}s from
 * {@link DetectionSettings}.
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * @param settings detector parameters; must not be {@code null}
     * @return unmodifiable list with one detector per detection method
     */
    public static List<WindowDetector> createAll(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        List<WindowDetector> detectors = List.of(
                new IqrDetector(settings.getIqrMultiplier()),
                new ZScoreDetector(settings.getZscoreThreshold()),
                new ModelOutlierDetector(),
                new MovingAverageDetector(settings.getMovingAverageWindow(),
                        settings.getMovingAverageThreshold()),
                new ForecastResidualDetector(settings.getForecastResidualThreshold()));
        LOG.info("Created {} detector(s) from configuration", detectors.size());
        return detectors;
    }
}
