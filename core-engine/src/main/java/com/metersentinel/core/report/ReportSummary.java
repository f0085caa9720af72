package com.metersentinel.core.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Consumption figures for one report period, handed to a report publisher.
 *
 * <p>
 * {@code fromCache} marks a summary built from the last-known-good window
 * because the reading source was unavailable.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"kind", "periodStart", "periodEnd", "generatedAt", "fromCache", "recordCount",
        "averagePowerKw", "maxPowerKw", "minPowerKw", "totalEnergyKwh",
        "subMetering1Wh", "subMetering2Wh", "subMetering3Wh", "anomalyCount"})
public final class ReportSummary {

    private final ReportKind kind;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final Instant generatedAt;
    private final boolean fromCache;
    private final int recordCount;
    private final double averagePowerKw;
    private final double maxPowerKw;
    private final double minPowerKw;
    private final double totalEnergyKwh;
    private final double subMetering1Wh;
    private final double subMetering2Wh;
    private final double subMetering3Wh;
    private final int anomalyCount;

    ReportSummary(ReportKind kind, LocalDate periodStart, LocalDate periodEnd, Instant generatedAt,
            boolean fromCache, int recordCount, double averagePowerKw, double maxPowerKw, double minPowerKw,
            double totalEnergyKwh, double subMetering1Wh, double subMetering2Wh, double subMetering3Wh,
            int anomalyCount) {
        this.kind = kind;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.generatedAt = generatedAt;
        this.fromCache = fromCache;
        this.recordCount = recordCount;
        this.averagePowerKw = averagePowerKw;
        this.maxPowerKw = maxPowerKw;
        this.minPowerKw = minPowerKw;
        this.totalEnergyKwh = totalEnergyKwh;
        this.subMetering1Wh = subMetering1Wh;
        this.subMetering2Wh = subMetering2Wh;
        this.subMetering3Wh = subMetering3Wh;
        this.anomalyCount = anomalyCount;
    }

    public ReportKind getKind() {
        return kind;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public double getAveragePowerKw() {
        return averagePowerKw;
    }

    public double getMaxPowerKw() {
        return maxPowerKw;
    }

    public double getMinPowerKw() {
        return minPowerKw;
    }

    public double getTotalEnergyKwh() {
        return totalEnergyKwh;
    }

    public double getSubMetering1Wh() {
        return subMetering1Wh;
    }

    public double getSubMetering2Wh() {
        return subMetering2Wh;
    }

    public double getSubMetering3Wh() {
        return subMetering3Wh;
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    @Override
    public String toString() {
        return "ReportSummary{" + kind.getKey() + " [" + periodStart + ", " + periodEnd + ")"
                + ", records=" + recordCount
                + ", avgKw=" + String.format("%.3f", averagePowerKw)
                + ", energyKwh=" + String.format("%.2f", totalEnergyKwh)
                + ", anomalies=" + anomalyCount
                + (fromCache ? ", fromCache" : "")
                + '}';
    }
}
