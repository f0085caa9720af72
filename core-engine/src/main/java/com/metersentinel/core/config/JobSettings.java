package com.metersentinel.core.config;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Trigger times for the five scheduled jobs.
 *
 * <p>
 * Times are {@code HH:mm} strings in the scheduler's time zone. Only the
 * logical fire times are configured here; the scheduler decides how to wait
 * for them.
 * </p>
 *
 * @since 1.0.0
 */
public class JobSettings {

    private int anomalyScanIntervalMinutes = 60;
    private int anomalyScanLookbackMinutes = 60;
    private String retrainingCheckTime = "03:00";
    private String dailyReportTime = "08:00";
    private String weeklyReportDay = "MONDAY";
    private String weeklyReportTime = "09:00";
    private int monthlyReportDay = 1;
    private String monthlyReportTime = "10:00";
    private boolean reportFallbackEnabled = true;

    void validate(List<String> errors) {
        if (anomalyScanIntervalMinutes < 1) {
            errors.add("jobs.anomalyScanIntervalMinutes must be >= 1, got: " + anomalyScanIntervalMinutes);
        }
        if (anomalyScanLookbackMinutes < 1) {
            errors.add("jobs.anomalyScanLookbackMinutes must be >= 1, got: " + anomalyScanLookbackMinutes);
        }
        checkTime("jobs.retrainingCheckTime", retrainingCheckTime, errors);
        checkTime("jobs.dailyReportTime", dailyReportTime, errors);
        checkTime("jobs.weeklyReportTime", weeklyReportTime, errors);
        checkTime("jobs.monthlyReportTime", monthlyReportTime, errors);
        try {
            weeklyReportDayOfWeek();
        } catch (IllegalArgumentException | NullPointerException e) {
            errors.add("jobs.weeklyReportDay is not a day of week: " + weeklyReportDay);
        }
        if (monthlyReportDay < 1 || monthlyReportDay > 31) {
            errors.add("jobs.monthlyReportDay must be in [1, 31], got: " + monthlyReportDay);
        }
    }

    private static void checkTime(String name, String value, List<String> errors) {
        try {
            LocalTime.parse(value);
        } catch (DateTimeParseException | NullPointerException e) {
            errors.add(name + " must be HH:mm, got: " + value);
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public LocalTime retrainingCheckLocalTime() {
        return LocalTime.parse(retrainingCheckTime);
    }

    public LocalTime dailyReportLocalTime() {
        return LocalTime.parse(dailyReportTime);
    }

    public DayOfWeek weeklyReportDayOfWeek() {
        return DayOfWeek.valueOf(weeklyReportDay.trim().toUpperCase(Locale.ROOT));
    }

    public LocalTime weeklyReportLocalTime() {
        return LocalTime.parse(weeklyReportTime);
    }

    public LocalTime monthlyReportLocalTime() {
        return LocalTime.parse(monthlyReportTime);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public int getAnomalyScanIntervalMinutes() {
        return anomalyScanIntervalMinutes;
    }

    public void setAnomalyScanIntervalMinutes(int anomalyScanIntervalMinutes) {
        this.anomalyScanIntervalMinutes = anomalyScanIntervalMinutes;
    }

    public int getAnomalyScanLookbackMinutes() {
        return anomalyScanLookbackMinutes;
    }

    public void setAnomalyScanLookbackMinutes(int anomalyScanLookbackMinutes) {
        this.anomalyScanLookbackMinutes = anomalyScanLookbackMinutes;
    }

    public String getRetrainingCheckTime() {
        return retrainingCheckTime;
    }

    public void setRetrainingCheckTime(String retrainingCheckTime) {
        this.retrainingCheckTime = retrainingCheckTime;
    }

    public String getDailyReportTime() {
        return dailyReportTime;
    }

    public void setDailyReportTime(String dailyReportTime) {
        this.dailyReportTime = dailyReportTime;
    }

    public String getWeeklyReportDay() {
        return weeklyReportDay;
    }

    public void setWeeklyReportDay(String weeklyReportDay) {
        this.weeklyReportDay = weeklyReportDay;
    }

    public String getWeeklyReportTime() {
        return weeklyReportTime;
    }

    public void setWeeklyReportTime(String weeklyReportTime) {
        this.weeklyReportTime = weeklyReportTime;
    }

    public int getMonthlyReportDay() {
        return monthlyReportDay;
    }

    public void setMonthlyReportDay(int monthlyReportDay) {
        this.monthlyReportDay = monthlyReportDay;
    }

    public String getMonthlyReportTime() {
        return monthlyReportTime;
    }

    public void setMonthlyReportTime(String monthlyReportTime) {
        this.monthlyReportTime = monthlyReportTime;
    }

    public boolean isReportFallbackEnabled() {
        return reportFallbackEnabled;
    }

    public void setReportFallbackEnabled(boolean reportFallbackEnabled) {
        this.reportFallbackEnabled = reportFallbackEnabled;
    }
}
