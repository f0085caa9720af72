package com.metersentinel.core.ml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.metersentinel.core.model.Reading;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Additive trend + weekly seasonality forecaster.
 *
 * <p>
 * {@code prediction(t) = intercept + slope × days(t) + seasonal[dayOfWeek(t), hour(t)]},
 * clamped at zero. The trend is an ordinary least-squares line through the
 * training values; the seasonal table holds the mean residual of every
 * (day-of-week, hour) slot. Slots never observed fall back to the mean
 * residual of the same hour across all days, then to zero.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * Immutable once fitted. The registry stores it as JSON with Jackson and
 * reads it back through the {@link JsonCreator} constructor.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SeasonalForecastModel implements ForecastModel {

    static final int SLOTS = 7 * 24;
    private static final double SECONDS_PER_DAY = 86_400.0;

    private final String zoneId;
    private final long originEpochSecond;
    private final double intercept;
    private final double slopePerDay;
    private final double[] seasonal;
    private final ZoneId zone;

    @JsonCreator
    public SeasonalForecastModel(@JsonProperty("zoneId") String zoneId,
                                 @JsonProperty("originEpochSecond") long originEpochSecond,
                                 @JsonProperty("intercept") double intercept,
                                 @JsonProperty("slopePerDay") double slopePerDay,
                                 @JsonProperty("seasonal") double[] seasonal) {
        if (seasonal == null || seasonal.length != SLOTS) {
            throw new IllegalArgumentException("Seasonal table must have " + SLOTS + " slots");
        }
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId must not be null");
        this.zone = ZoneId.of(zoneId);
        this.originEpochSecond = originEpochSecond;
        this.intercept = intercept;
        this.slopePerDay = slopePerDay;
        this.seasonal = seasonal.clone();
    }

    /**
     * Fit a model on readings with finite active power.
     *
     * @param readings training readings in time order; must not be empty
     * @param zone     zone used to derive hour and day of week
     * @return fitted model
     * @throws IllegalArgumentException if no reading has a finite power value
     */
    public static SeasonalForecastModel fit(List<Reading> readings, ZoneId zone) {
        Objects.requireNonNull(readings, "readings must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        List<Reading> usable = readings.stream()
                .filter(r -> Double.isFinite(r.getActivePowerKw()))
                .toList();
        if (usable.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a forecast on zero usable readings");
        }

        long origin = usable.get(0).getTimestamp().getEpochSecond();
        int n = usable.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = daysSince(origin, usable.get(i).getTimestamp());
            y[i] = usable.get(i).getActivePowerKw();
        }

        double xMean = Statistics.mean(x);
        double yMean = Statistics.mean(y);
        double cov = 0;
        double variance = 0;
        for (int i = 0; i < n; i++) {
            cov += (x[i] - xMean) * (y[i] - yMean);
            variance += (x[i] - xMean) * (x[i] - xMean);
        }
        double slope = variance == 0 ? 0.0 : cov / variance;
        double intercept = yMean - slope * xMean;

        double[] slotSum = new double[SLOTS];
        int[] slotCount = new int[SLOTS];
        double[] hourSum = new double[24];
        int[] hourCount = new int[24];
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (intercept + slope * x[i]);
            int slot = slotOf(zone, usable.get(i).getTimestamp());
            slotSum[slot] += residual;
            slotCount[slot]++;
            hourSum[slot % 24] += residual;
            hourCount[slot % 24]++;
        }
        double[] seasonal = new double[SLOTS];
        for (int slot = 0; slot < SLOTS; slot++) {
            if (slotCount[slot] > 0) {
                seasonal[slot] = slotSum[slot] / slotCount[slot];
            } else if (hourCount[slot % 24] > 0) {
                seasonal[slot] = hourSum[slot % 24] / hourCount[slot % 24];
            }
        }
        return new SeasonalForecastModel(zone.getId(), origin, intercept, slope, seasonal);
    }

    @Override
    public double predict(Instant timestamp) {
        double value = intercept + slopePerDay * daysSince(originEpochSecond, timestamp)
                + seasonal[slotOf(zone, timestamp)];
        return Math.max(0.0, value);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double daysSince(long originEpochSecond, Instant timestamp) {
        return (timestamp.getEpochSecond() - originEpochSecond) / SECONDS_PER_DAY;
    }

    private static int slotOf(ZoneId zone, Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(zone);
        return (local.getDayOfWeek().getValue() - 1) * 24 + local.getHour();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getZoneId() {
        return zoneId;
    }

    public long getOriginEpochSecond() {
        return originEpochSecond;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getSlopePerDay() {
        return slopePerDay;
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }
}
