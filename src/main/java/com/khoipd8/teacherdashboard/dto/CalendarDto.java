package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.khoipd8.teacherdashboard.model.CalendarEvent;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CalendarDto {
    /** Five weeks, Sunday first. */
    private List<List<CalendarDay>> calendarData;
    private List<CalendarEvent> upcomingEvents;

    @Data
    @Builder
    public static class CalendarDay {
        private int date;

        @JsonProperty("isCurrentMonth")
        private boolean currentMonth;

        @JsonProperty("isToday")
        private boolean today;

        private List<DayEvent> events;
    }

    @Data
    @Builder
    public static class DayEvent {
        private String id;
        private String title;
        private String type;
        private String time;
    }
}
