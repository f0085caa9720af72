package com.metersentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one detection run for a single reading index.
 *
 * <p>
 * Verdicts are produced once per run, immutable, and handed to the
 * notification collaborator. They are not a system of record: the reading
 * source stays authoritative.
 * </p>
 *
 * <h3>Data defects</h3>
 * <p>
 * A physically implausible reading is marked {@link #isDataDefect()} and casts
 * no votes. It is never a consensus anomaly.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyVerdict {

    private final int index;
    private final Instant timestamp;
    private final double activePowerKw;
    private final Map<DetectionMethod, Boolean> flags;
    private final int votes;
    private final boolean consensus;
    private final AnomalyCategory category;
    private final SeverityTier severity;
    private final double score;
    private final boolean dataDefect;

    private AnomalyVerdict(Builder b) {
        this.index = b.index;
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.activePowerKw = b.activePowerKw;
        EnumMap<DetectionMethod, Boolean> copy = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            copy.put(method, Boolean.TRUE.equals(b.flags.get(method)));
        }
        this.flags = Collections.unmodifiableMap(copy);
        this.votes = (int) copy.values().stream().filter(Boolean::booleanValue).count();
        this.consensus = b.consensus;
        this.category = b.category;
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.score = b.score;
        this.dataDefect = b.dataDefect;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getIndex() {
        return index;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getActivePowerKw() {
        return activePowerKw;
    }

    /**
     * @return one entry per {@link DetectionMethod}; never missing a key
     */
    public Map<DetectionMethod, Boolean> getFlags() {
        return flags;
    }

    public boolean isFlaggedBy(DetectionMethod method) {
        return flags.get(method);
    }

    public int getVotes() {
        return votes;
    }

    public boolean isConsensus() {
        return consensus;
    }

    /**
     * @return the category, present only for classified consensus anomalies
     */
    public Optional<AnomalyCategory> getCategory() {
        return Optional.ofNullable(category);
    }

    public SeverityTier getSeverity() {
        return severity;
    }

    public double getScore() {
        return score;
    }

    public boolean isDataDefect() {
        return dataDefect;
    }

    /**
     * Notification policy: only confirmed anomalies of tier MEDIUM or above.
     *
     * @return {@code true} if a caller should notify about this verdict
     */
    public boolean shouldNotify() {
        return consensus && severity.isAtLeast(SeverityTier.MEDIUM);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private int index;
        private Instant timestamp;
        private double activePowerKw;
        private final Map<DetectionMethod, Boolean> flags = new EnumMap<>(DetectionMethod.class);
        private boolean consensus;
        private AnomalyCategory category;
        private SeverityTier severity = SeverityTier.LOW;
        private double score;
        private boolean dataDefect;

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder activePowerKw(double activePowerKw) {
            this.activePowerKw = activePowerKw;
            return this;
        }

        public Builder flag(DetectionMethod method, boolean flagged) {
            this.flags.put(method, flagged);
            return this;
        }

        public Builder consensus(boolean consensus) {
            this.consensus = consensus;
            return this;
        }

        public Builder category(AnomalyCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(SeverityTier severity) {
            this.severity = severity;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder dataDefect(boolean dataDefect) {
            this.dataDefect = dataDefect;
            return this;
        }

        public AnomalyVerdict build() {
            return new AnomalyVerdict(this);
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
        if (!(o instanceof AnomalyVerdict that)) {
            return false;
        }
        return index == that.index
                && consensus == that.consensus
                && dataDefect == that.dataDefect
                && Double.compare(activePowerKw, that.activePowerKw) == 0
                && Double.compare(score, that.score) == 0
                && timestamp.equals(that.timestamp)
                && flags.equals(that.flags)
                && category == that.category
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, timestamp, activePowerKw, flags, consensus, category,
                severity, score, dataDefect);
    }

    @Override
    public String toString() {
        return "AnomalyVerdict{" +
                "index=" + index +
                ", timestamp=" + timestamp +
                ", activePowerKw=" + activePowerKw +
                ", votes=" + votes +
                ", consensus=" + consensus +
                ", category=" + (category != null ? category.getLabel() : "none") +
                ", severity=" + severity +
                ", score=" + String.format("%.1f", score) +
                (dataDefect ? ", dataDefect=true" : "") +
                '}';
    }
}
