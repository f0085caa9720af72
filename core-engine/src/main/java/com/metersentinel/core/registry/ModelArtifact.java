package com.metersentinel.core.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted, immutable model plus its metadata.
 *
 * <p>
 * Retraining never mutates an artifact; it always writes a new version. The
 * model itself is kept as an opaque JSON payload that only the owning model
 * class knows how to read.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ModelArtifact {

    private final ModelKind kind;
    private final String versionId;
    private final Instant trainedAt;
    private final int trainingRecordCount;
    private final Map<String, Double> metrics;
    private final JsonNode payload;

    @JsonCreator
    public ModelArtifact(@JsonProperty("kind") ModelKind kind,
            @JsonProperty("versionId") String versionId,
            @JsonProperty("trainedAt") Instant trainedAt,
            @JsonProperty("trainingRecordCount") int trainingRecordCount,
            @JsonProperty("metrics") Map<String, Double> metrics,
            @JsonProperty("payload") JsonNode payload) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.versionId = Objects.requireNonNull(versionId, "versionId must not be null");
        this.trainedAt = Objects.requireNonNull(trainedAt, "trainedAt must not be null");
        this.trainingRecordCount = trainingRecordCount;
        this.metrics = metrics != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
                : Collections.emptyMap();
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
    }

    public ModelKind getKind() {
        return kind;
    }

    public String getVersionId() {
        return versionId;
    }

    public Instant getTrainedAt() {
        return trainedAt;
    }

    public int getTrainingRecordCount() {
        return trainingRecordCount;
    }

    public Map<String, Double> getMetrics() {
        return metrics;
    }

    public JsonNode getPayload() {
        return payload.deepCopy();
    }

    @Override
    public String toString() {
        return "ModelArtifact{kind=" + kind + ", versionId='" + versionId + "', trainedAt=" + trainedAt
                + ", trainingRecordCount=" + trainingRecordCount + ", metrics=" + metrics + '}';
    }
}
