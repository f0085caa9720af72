package com.metersentinel.core.report;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Report cadence. Each kind covers whole days ending at midnight of the run
 * date. The weekly period is the seven days before the run date whatever
 * weekday the trigger fires on; the monthly period is the previous calendar
 * month.
 *
 * @since 1.0.0
 */
public enum ReportKind {

    /** The previous calendar day. */
    DAILY("daily"),
    /** The seven days before the run date. */
    WEEKLY("weekly"),
    /** The previous calendar month. */
    MONTHLY("monthly");

    private final String key;

    ReportKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * @param runDate local date on which the report runs
     * @param zone    zone that defines day boundaries
     * @return the period this report covers
     */
    public ReportPeriod periodFor(LocalDate runDate, ZoneId zone) {
        LocalDate start;
        LocalDate end;
        switch (this) {
            case DAILY -> {
                end = runDate;
                start = runDate.minusDays(1);
            }
            case WEEKLY -> {
                end = runDate;
                start = runDate.minusDays(7);
            }
            case MONTHLY -> {
                end = runDate.withDayOfMonth(1);
                start = end.minusMonths(1);
            }
            default -> throw new IllegalStateException("Unhandled report kind " + this);
        }
        return new ReportPeriod(this, start, end, zone);
    }
}
