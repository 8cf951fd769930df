package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CalendarDto;
import com.khoipd8.teacherdashboard.model.CalendarEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalendarServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-28T08:00:00Z"), ZoneOffset.UTC);

    private final InMemoryTableStore store = new InMemoryTableStore().sheet("Events",
            List.of("Id", "Date", "Title", "Type", "Time", "Description"), List.of(
                    row("E1", "2024-03-28", "Science Exam", "Exam", "10:00 AM", "Lab block"),
                    row("E2", "2024-03-01", "Sports Day", "Event"),
                    row("E3", "2024/04/02", "PTM", "Meeting"),
                    row("E4", "someday", "Trip", "Event")));

    private CalendarDto calendar() {
        return new CalendarService(store.loader(), clock).calendar();
    }

    @Test
    void gridMarksTodayAndMonthBoundary() {
        List<List<CalendarDto.CalendarDay>> grid = calendar().getCalendarData();

        assertEquals(5, grid.size());
        grid.forEach(week -> assertEquals(7, week.size()));

        // Sunday 24 March is the first cell
        assertEquals(24, grid.get(0).get(0).getDate());
        long todays = grid.stream().flatMap(List::stream).filter(CalendarDto.CalendarDay::isToday).count();
        assertEquals(1, todays);

        CalendarDto.CalendarDay today = grid.get(0).get(4);
        assertTrue(today.isToday());
        assertEquals(28, today.getDate());
        assertEquals(1, today.getEvents().size());
        assertEquals("exam", today.getEvents().get(0).getType());

        CalendarDto.CalendarDay april2 = grid.get(1).get(2);
        assertEquals(2, april2.getDate());
        assertFalse(april2.isCurrentMonth());
        assertEquals("PTM", april2.getEvents().get(0).getTitle());
        assertEquals("All Day", april2.getEvents().get(0).getTime());
    }

    @Test
    void upcomingEventsStartToday() {
        List<CalendarEvent> upcoming = calendar().getUpcomingEvents();

        assertEquals(List.of("E1", "E3"), upcoming.stream().map(CalendarEvent::getId).collect(Collectors.toList()));
        assertEquals("", upcoming.get(1).getDescription());
    }
}
