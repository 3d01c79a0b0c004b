package com.momentumquant.rebalancer.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar of rebalance dates: one configured weekday per week.
 * Dates are calendar dates; whether the market traded is checked by the simulator.
 */
public final class RebalanceSchedule {

    private RebalanceSchedule() {
    }

    public static List<LocalDate> weekly(LocalDate start, LocalDate end, DayOfWeek day) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate date = start.with(TemporalAdjusters.nextOrSame(day));
        while (!date.isAfter(end)) {
            dates.add(date);
            date = date.plusWeeks(1);
        }
        return dates;
    }
}
