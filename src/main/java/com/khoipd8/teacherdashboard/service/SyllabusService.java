package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.SyllabusDto;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.model.SyllabusTopic;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.CellValues;
import com.khoipd8.teacherdashboard.table.Percentages;
import com.khoipd8.teacherdashboard.table.Sheets;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Syllabus coverage by unit and by topic group, plus the next pending topics.
 */
@Service
public class SyllabusService {

    public static final int UPCOMING_LIMIT = 5;

    static final String COMPLETED = "Completed";
    static final String PENDING = "Pending";
    static final String PLANNED_START_DEFAULT = "Next Week";

    private final TableSnapshotLoader loader;
    private final FallbackPolicy fallbackPolicy;

    public SyllabusService(TableSnapshotLoader loader, FallbackPolicy fallbackPolicy) {
        this.loader = loader;
        this.fallbackPolicy = fallbackPolicy;
    }

    public SyllabusDto syllabus() {
        List<SyllabusTopic> topics = loader.load(Sheets.SYLLABUS).records(Sheets.SYLLABUS, RecordMapper::syllabusTopic);
        SyntheticMetrics synthetic = new SyntheticMetrics();
        synthetic.mark("remainingDays");

        List<SyllabusTopic> completed = topics.stream()
                .filter(t -> COMPLETED.equals(t.getStatus()))
                .collect(Collectors.toList());

        List<SyllabusDto.UnitCompletion> unitCompletion = new ArrayList<>();
        Aggregator.groupByDistinct(topics, SyllabusTopic::getUnit).forEach((unit, unitTopics) ->
                unitCompletion.add(new SyllabusDto.UnitCompletion(unit, Percentages.of(
                        Aggregator.countEqual(unitTopics, SyllabusTopic::getStatus, COMPLETED), unitTopics.size(), 0))));

        List<SyllabusDto.TimeAllocation> timeAllocation = new ArrayList<>();
        for (Map.Entry<String, List<SyllabusTopic>> group
                : Aggregator.groupByDistinct(topics, SyllabusTopic::getTopicGroup).entrySet()) {
            int planned = 0;
            int actual = 0;
            for (SyllabusTopic topic : group.getValue()) {
                planned += CellValues.leadingInt(topic.getExpectedHours());
                actual += CellValues.leadingInt(topic.getTimeSpent());
            }
            timeAllocation.add(new SyllabusDto.TimeAllocation(group.getKey(), planned, synthetic.take(
                    "timeAllocation[" + timeAllocation.size() + "].actual",
                    fallbackPolicy.actualHours(actual, planned))));
        }

        return SyllabusDto.builder()
                .completionPercentage(Percentages.of(completed.size(), topics.size(), 0))
                .completedUnits(Aggregator.distinctCount(completed, SyllabusTopic::getUnit))
                .totalUnits(Aggregator.distinctCount(topics, SyllabusTopic::getUnit))
                .remainingDays(FallbackPolicy.REMAINING_TEACHING_DAYS)
                .topics(topics.stream().map(SyllabusService::topic).collect(Collectors.toList()))
                .unitCompletion(unitCompletion)
                .timeAllocation(timeAllocation)
                .upcomingTopics(upcoming(topics))
                .syntheticMetrics(synthetic.asList())
                .build();
    }

    /** Pending topics by start date, undated ones last. */
    static List<SyllabusDto.UpcomingTopic> upcoming(List<SyllabusTopic> topics) {
        return topics.stream()
                .filter(t -> PENDING.equals(t.getStatus()))
                .sorted(Comparator.comparing((SyllabusTopic t) -> CellValues.parseDate(t.getStartDate()).orElse(null),
                        Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())))
                .limit(UPCOMING_LIMIT)
                .map(t -> SyllabusDto.UpcomingTopic.builder()
                        .id(t.getId())
                        .name(t.getName())
                        .unit(t.getUnit())
                        .plannedStart(t.getStartDate() != null ? t.getStartDate() : PLANNED_START_DEFAULT)
                        .estimatedHours(t.getExpectedHours())
                        .build())
                .collect(Collectors.toList());
    }

    private static SyllabusDto.Topic topic(SyllabusTopic t) {
        return SyllabusDto.Topic.builder()
                .id(t.getId())
                .unit(t.getUnit())
                .name(t.getName())
                .expectedHours(t.getExpectedHours())
                .timeSpent(t.getTimeSpent())
                .status(t.getStatus())
                .startDate(t.getStartDate())
                .completionDate(t.getCompletionDate())
                .build();
    }
}
