package com.metersentinel.core.report;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open local-date range {@code [startDate, endDate)} resolved in a zone.
 *
 * @since 1.0.0
 */
public final class ReportPeriod {

    private final ReportKind kind;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final ZoneId zone;

    public ReportPeriod(ReportKind kind, LocalDate startDate, LocalDate endDate, ZoneId zone) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.startDate = Objects.requireNonNull(startDate, "startDate must not be null");
        this.endDate = Objects.requireNonNull(endDate, "endDate must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        if (!startDate.isBefore(endDate)) {
            throw new IllegalArgumentException("startDate must be before endDate: " + startDate + " / " + endDate);
        }
    }

    public ReportKind getKind() {
        return kind;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public ZoneId getZone() {
        return zone;
    }

    public Instant startInstant() {
        return startDate.atStartOfDay(zone).toInstant();
    }

    public Instant endInstant() {
        return endDate.atStartOfDay(zone).toInstant();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportPeriod that)) return false;
        return kind == that.kind && startDate.equals(that.startDate)
                && endDate.equals(that.endDate) && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, startDate, endDate, zone);
    }

    @Override
    public String toString() {
        return kind.getKey() + "[" + startDate + ", " + endDate + ")";
    }
}
