package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.AssessmentsDto;
import com.khoipd8.teacherdashboard.model.Assessment;
import com.khoipd8.teacherdashboard.model.Grade;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.CellValues;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.LabelCount;
import com.khoipd8.teacherdashboard.table.Percentages;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assessment calendar, class averages and grade distribution.
 */
@Service
public class AssessmentService {

    public static final int TREND_LIMIT = 5;

    static final String SCHEDULED = "Scheduled";
    static final String COMPLETED = "Completed";

    /** Ascending by date; rows whose date does not parse keep their order after the dated ones. */
    static final Comparator<AssessmentsDto.AssessmentSummary> BY_DATE = Comparator.comparing(
            (AssessmentsDto.AssessmentSummary a) -> CellValues.parseDate(a.getDate()).orElse(null),
            Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    private final TableSnapshotLoader loader;
    private final FallbackPolicy fallbackPolicy;

    public AssessmentService(TableSnapshotLoader loader, FallbackPolicy fallbackPolicy) {
        this.loader = loader;
        this.fallbackPolicy = fallbackPolicy;
    }

    public AssessmentsDto assessments() {
        TableSnapshot snapshot = loader.load(Sheets.ASSESSMENTS, Sheets.GRADES);
        List<Assessment> assessments = snapshot.records(Sheets.ASSESSMENTS, RecordMapper::assessment);
        List<Grade> grades = snapshot.records(Sheets.GRADES, RecordMapper::grade);
        JoinIndex<Grade> gradesByAssessment = JoinIndex.on(grades, Grade::getAssessmentId);
        SyntheticMetrics synthetic = new SyntheticMetrics();

        List<AssessmentsDto.AssessmentSummary> summaries = assessments.stream()
                .map(a -> AssessmentsDto.AssessmentSummary.builder()
                        .id(a.getId())
                        .date(a.getDate())
                        .title(a.getTitle())
                        .type(a.getType())
                        .maxScore(a.getMaxScore())
                        .average(average(gradesByAssessment.findAll(a.getId())))
                        .status(a.getStatus())
                        .build())
                .sorted(BY_DATE)
                .collect(Collectors.toList());

        AssessmentsDto.AssessmentSummary next = summaries.stream()
                .filter(a -> SCHEDULED.equals(a.getStatus()))
                .findFirst()
                .orElse(null);
        AssessmentsDto.NextAssessment nextAssessment;
        if (next != null) {
            nextAssessment = new AssessmentsDto.NextAssessment(next.getDate(), next.getTitle());
        } else {
            synthetic.mark("nextAssessment");
            nextAssessment = new AssessmentsDto.NextAssessment(
                    FallbackPolicy.NEXT_ASSESSMENT_DATE, FallbackPolicy.NEXT_ASSESSMENT_NAME);
        }

        List<AssessmentsDto.AssessmentSummary> graded = summaries.stream()
                .filter(AssessmentService::isGradedCompletion)
                .collect(Collectors.toList());
        int lastAverage = synthetic.take("lastAssessmentAverage",
                fallbackPolicy.lastAssessmentAverage(latest(graded)));

        int pendingGrades = Aggregator.countMatching(summaries,
                a -> COMPLETED.equals(a.getStatus()) && !isGradedCompletion(a));

        List<LabelCount> actualCounts = Aggregator.countByLabels(grades, Grade::getGrade, FallbackPolicy.gradeLabels());
        List<AssessmentsDto.GradeCount> distribution = new ArrayList<>(actualCounts.size());
        for (LabelCount count : actualCounts) {
            distribution.add(new AssessmentsDto.GradeCount(count.getLabel(), synthetic.take(
                    "gradeDistribution[" + distribution.size() + "].count",
                    fallbackPolicy.gradeCount(count.getLabel(), count.getCount()))));
        }

        List<AssessmentsDto.TrendPoint> trend = graded.stream()
                .limit(TREND_LIMIT)
                .map(a -> new AssessmentsDto.TrendPoint(a.getTitle(), a.getAverage()))
                .collect(Collectors.toList());
        if (trend.size() < FallbackPolicy.MIN_TREND_POINTS) {
            for (Map.Entry<String, Integer> sample : FallbackPolicy.SAMPLE_PERFORMANCE_TREND.entrySet()) {
                synthetic.mark("performanceTrend[" + trend.size() + "]");
                trend.add(new AssessmentsDto.TrendPoint(sample.getKey(), sample.getValue()));
            }
        }

        return AssessmentsDto.builder()
                .nextAssessment(nextAssessment)
                .lastAssessmentAverage(lastAverage)
                .pendingGrades(pendingGrades)
                .assessments(summaries)
                .gradeDistribution(distribution)
                .performanceTrend(trend)
                .syntheticMetrics(synthetic.asList())
                .build();
    }

    /** Rounded mean of the leading number of each grade's percentage cell; null without grades. */
    static Integer average(List<Grade> grades) {
        if (grades.isEmpty()) {
            return null;
        }
        double total = 0;
        for (Grade grade : grades) {
            total += CellValues.leadingNumber(grade.getPercentage());
        }
        return Percentages.roundedMean(total, grades.size());
    }

    private static boolean isGradedCompletion(AssessmentsDto.AssessmentSummary a) {
        return COMPLETED.equals(a.getStatus()) && a.getAverage() != null && a.getAverage() != 0;
    }

    /**
     * Average of the most recent dated entry, else of the first undated one. On a tied date the
     * earlier row wins.
     */
    private static Integer latest(List<AssessmentsDto.AssessmentSummary> ascending) {
        AssessmentsDto.AssessmentSummary latest = null;
        LocalDate latestDate = null;
        for (AssessmentsDto.AssessmentSummary a : ascending) {
            LocalDate date = CellValues.parseDate(a.getDate()).orElse(null);
            if (latest == null || (date != null && (latestDate == null || date.isAfter(latestDate)))) {
                latest = a;
                latestDate = date;
            }
        }
        return latest == null ? null : latest.getAverage();
    }
}
