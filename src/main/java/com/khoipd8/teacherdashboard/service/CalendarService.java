package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CalendarDto;
import com.khoipd8.teacherdashboard.model.CalendarEvent;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.CellValues;
import com.khoipd8.teacherdashboard.table.DateWindows;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.Sheets;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
public class CalendarService {

    public static final int UPCOMING_LIMIT = 5;

    private final TableSnapshotLoader loader;
    private final Clock clock;

    public CalendarService(TableSnapshotLoader loader, Clock clock) {
        this.loader = loader;
        this.clock = clock;
    }

    /**
     * Five-week grid starting at the Sunday on or before today, plus the next events on or after
     * today. Events whose date does not parse appear in neither.
     */
    public CalendarDto calendar() {
        List<CalendarEvent> events = loader.load(Sheets.EVENTS).records(Sheets.EVENTS, RecordMapper::event);
        LocalDate today = LocalDate.now(clock);
        JoinIndex<CalendarEvent> eventsByDay = JoinIndex.on(events, e -> CellValues.isoDate(e.getDate()));

        List<List<CalendarDto.CalendarDay>> grid = new ArrayList<>(DateWindows.GRID_WEEKS);
        for (List<LocalDate> week : DateWindows.calendarGrid(today, DateWindows.GRID_WEEKS)) {
            List<CalendarDto.CalendarDay> days = new ArrayList<>(week.size());
            for (LocalDate day : week) {
                days.add(CalendarDto.CalendarDay.builder()
                        .date(day.getDayOfMonth())
                        .currentMonth(day.getMonth() == today.getMonth())
                        .today(day.equals(today))
                        .events(eventsByDay.findAll(day.toString()).stream()
                                .map(CalendarService::dayEvent)
                                .collect(Collectors.toList()))
                        .build());
            }
            grid.add(days);
        }

        List<CalendarEvent> upcoming = events.stream()
                .filter(e -> CellValues.parseDate(e.getDate()).map(d -> !d.isBefore(today)).orElse(false))
                .sorted(Comparator.comparing(e -> CellValues.parseDate(e.getDate()).orElseThrow()))
                .limit(UPCOMING_LIMIT)
                .collect(Collectors.toList());

        return CalendarDto.builder()
                .calendarData(grid)
                .upcomingEvents(upcoming)
                .build();
    }

    private static CalendarDto.DayEvent dayEvent(CalendarEvent event) {
        return CalendarDto.DayEvent.builder()
                .id(event.getId())
                .title(event.getTitle())
                .type(event.getType() == null ? null : event.getType().toLowerCase(Locale.ROOT))
                .time(event.getTime())
                .build();
    }
}
