package com.metersentinel.core.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.metersentinel.core.ml.ModelMetrics;

import java.time.Instant;
import java.util.Objects;

/**
 * Both production pointers plus the metrics of the forecasting artifact
 * they reference.
 *
 * <p>
 * Persisted as a single {@code production.json} so that repointing both
 * kinds is one atomic file replacement. Instances are immutable; promotion
 * swaps the whole snapshot.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ProductionSnapshot {

    private final String forecastingVersion;
    private final String outlierVersion;
    private final Instant promotedAt;
    private final int trainingRecordCount;
    private final ModelMetrics forecastMetrics;

    @JsonCreator
    public ProductionSnapshot(@JsonProperty("best_forecasting") String forecastingVersion,
            @JsonProperty("best_outlier") String outlierVersion,
            @JsonProperty("promotedAt") Instant promotedAt,
            @JsonProperty("trainingRecordCount") int trainingRecordCount,
            @JsonProperty("forecastMetrics") ModelMetrics forecastMetrics) {
        this.forecastingVersion = Objects.requireNonNull(forecastingVersion, "best_forecasting must not be null");
        this.outlierVersion = Objects.requireNonNull(outlierVersion, "best_outlier must not be null");
        this.promotedAt = Objects.requireNonNull(promotedAt, "promotedAt must not be null");
        this.trainingRecordCount = trainingRecordCount;
        this.forecastMetrics = Objects.requireNonNull(forecastMetrics, "forecastMetrics must not be null");
    }

    @JsonProperty("best_forecasting")
    public String getForecastingVersion() {
        return forecastingVersion;
    }

    @JsonProperty("best_outlier")
    public String getOutlierVersion() {
        return outlierVersion;
    }

    public Instant getPromotedAt() {
        return promotedAt;
    }

    public int getTrainingRecordCount() {
        return trainingRecordCount;
    }

    public ModelMetrics getForecastMetrics() {
        return forecastMetrics;
    }

    /**
     * @param kind artifact kind
     * @return version the kind's pointer references
     */
    public String versionOf(ModelKind kind) {
        return kind == ModelKind.FORECASTING ? forecastingVersion : outlierVersion;
    }

    @Override
    public String toString() {
        return "ProductionSnapshot{best_forecasting='" + forecastingVersion
                + "', best_outlier='" + outlierVersion
                + "', promotedAt=" + promotedAt
                + ", metrics=" + forecastMetrics + '}';
    }
}
