package com.khoipd8.teacherdashboard.table;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Calendar windows used by the attendance trend and the month grid.
 */
public final class DateWindows {

    public static final int GRID_WEEKS = 5;

    private DateWindows() {
    }

    /** The {@code days} calendar dates ending at {@code today}, newest first. */
    public static List<LocalDate> lastDays(LocalDate today, int days) {
        List<LocalDate> window = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            window.add(today.minusDays(i));
        }
        return window;
    }

    public static Set<String> lastDaysIso(LocalDate today, int days) {
        Set<String> window = new LinkedHashSet<>();
        lastDays(today, days).forEach(day -> window.add(day.toString()));
        return window;
    }

    /** Sunday on or before {@code today}. */
    public static LocalDate weekStart(LocalDate today) {
        return today.with(TemporalAdjusters.previousOrSame(DayOfWeek.SUNDAY));
    }

    /** {@code weeks} rows of seven days each, Sunday first, starting at the current week. */
    public static List<List<LocalDate>> calendarGrid(LocalDate today, int weeks) {
        LocalDate start = weekStart(today);
        List<List<LocalDate>> grid = new ArrayList<>(weeks);
        for (int week = 0; week < weeks; week++) {
            List<LocalDate> days = new ArrayList<>(7);
            for (int day = 0; day < 7; day++) {
                days.add(start.plusDays(week * 7L + day));
            }
            grid.add(days);
        }
        return grid;
    }
}
