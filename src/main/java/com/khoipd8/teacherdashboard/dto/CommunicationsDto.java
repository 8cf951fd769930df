package com.khoipd8.teacherdashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.khoipd8.teacherdashboard.model.CommunicationLog;
import com.khoipd8.teacherdashboard.model.ParentContact;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CommunicationsDto {
    private int parentMeetings;
    private int pendingResponses;

    @JsonProperty("nextPTM")
    private MeetingSlot nextPtm;

    private List<CommunicationLog> communicationLogs;
    private List<ParentContact> parentDirectory;
    private List<String> syntheticMetrics;

    @Data
    @AllArgsConstructor
    public static class MeetingSlot {
        private String date;
        private String time;
        private String day;
    }
}
