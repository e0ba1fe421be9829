package com.family.library.conversation;

import java.time.LocalDate;

/**
 * Values collected by {@code /stats}: the resolved reporting window and its label.
 */
public final class StatsData extends DialogData {

    public enum Awaiting { NOTHING, MONTH, YEAR }

    private final Awaiting awaiting;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final String periodLabel;

    private StatsData(Awaiting awaiting, LocalDate startDate, LocalDate endDate, String periodLabel) {
        this.awaiting = awaiting;
        this.startDate = startDate;
        this.endDate = endDate;
        this.periodLabel = periodLabel;
    }

    public static StatsData empty() {
        return new StatsData(Awaiting.NOTHING, null, null, null);
    }

    @Override
    public DialogCommand command() {
        return DialogCommand.STATS;
    }

    public Awaiting getAwaiting() {
        return awaiting;
    }

    public LocalDate requireStartDate() {
        return require(startDate, "startDate");
    }

    public LocalDate requireEndDate() {
        return require(endDate, "endDate");
    }

    public String requirePeriodLabel() {
        return require(periodLabel, "periodLabel");
    }

    public StatsData awaiting(Awaiting awaiting) {
        return new StatsData(awaiting, startDate, endDate, periodLabel);
    }

    public StatsData withPeriod(LocalDate startDate, LocalDate endDate, String periodLabel) {
        return new StatsData(Awaiting.NOTHING, startDate, endDate, periodLabel);
    }

    @Override
    public String toString() {
        return "StatsData{awaiting=" + awaiting + ", start=" + startDate + ", end=" + endDate
                + ", label=" + periodLabel + "}";
    }
}
