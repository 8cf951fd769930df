package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CommunicationsDto;
import com.khoipd8.teacherdashboard.model.CommunicationLog;
import com.khoipd8.teacherdashboard.model.ParentContact;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.CellValues;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;

/** Parent communication log and directory. */
@Service
public class CommunicationService {

    static final String MEETING = "Meeting";
    static final String PENDING = "Pending";

    private final TableSnapshotLoader loader;
    private final Clock clock;

    public CommunicationService(TableSnapshotLoader loader, Clock clock) {
        this.loader = loader;
        this.clock = clock;
    }

    public CommunicationsDto communications() {
        TableSnapshot snapshot = loader.load(Sheets.COMMUNICATIONS, Sheets.PARENTS);
        List<CommunicationLog> logs = snapshot.records(Sheets.COMMUNICATIONS, RecordMapper::communication);
        List<ParentContact> parents = snapshot.records(Sheets.PARENTS, RecordMapper::parent);

        // month of year only, a meeting from the same month last year still counts
        Month thisMonth = LocalDate.now(clock).getMonth();
        int meetings = Aggregator.countMatching(logs, c -> MEETING.equals(c.getType())
                && CellValues.parseDate(c.getDate()).map(d -> d.getMonth() == thisMonth).orElse(false));

        SyntheticMetrics synthetic = new SyntheticMetrics();
        synthetic.mark("nextPTM");

        return CommunicationsDto.builder()
                .parentMeetings(meetings)
                .pendingResponses(Aggregator.countEqual(logs, CommunicationLog::getStatus, PENDING))
                .nextPtm(new CommunicationsDto.MeetingSlot(
                        FallbackPolicy.NEXT_PTM_DATE, FallbackPolicy.NEXT_PTM_TIME, FallbackPolicy.NEXT_PTM_DAY))
                .communicationLogs(logs)
                .parentDirectory(parents)
                .syntheticMetrics(synthetic.asList())
                .build();
    }
}
