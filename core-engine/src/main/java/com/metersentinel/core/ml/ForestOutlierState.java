package com.metersentinel.core.ml;

import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Serialisable snapshot of a {@link ForestOutlierModel}.
 *
 * <p>
 * Holds the forest state produced by the Random Cut Forest mapper together
 * with the feature scaling and decision threshold learned at training time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForestOutlierState {

    private String zoneId;
    private double[] means;
    private double[] scales;
    private double threshold;
    private double contamination;
    private long randomSeed;
    private RandomCutForestState forest;

    /** No-arg constructor required by Jackson. */
    public ForestOutlierState() {
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public double[] getMeans() {
        return means;
    }

    public void setMeans(double[] means) {
        this.means = means;
    }

    public double[] getScales() {
        return scales;
    }

    public void setScales(double[] scales) {
        this.scales = scales;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public double getContamination() {
        return contamination;
    }

    public void setContamination(double contamination) {
        this.contamination = contamination;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public RandomCutForestState getForest() {
        return forest;
    }

    public void setForest(RandomCutForestState forest) {
        this.forest = forest;
    }
}
