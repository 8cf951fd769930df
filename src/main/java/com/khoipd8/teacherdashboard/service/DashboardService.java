package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CategoryCountDto;
import com.khoipd8.teacherdashboard.dto.CountDto;
import com.khoipd8.teacherdashboard.dto.DashboardDto;
import com.khoipd8.teacherdashboard.model.Course;
import com.khoipd8.teacherdashboard.model.PerformanceRecord;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.model.Student;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Headline counters for the landing page.
 */
@Service
public class DashboardService {

    public static final List<String> CASTE_CATEGORIES = List.of("General", "OBC", "SC", "ST", "Muslim");
    public static final List<String> PERFORMANCE_LABELS = List.of("Excellent", "Good", "Average", "Needs Improvement");

    public static final String BRIGHT_LEARNER = "Bright Learner";
    public static final String LATE_BLOOMER = "Late Bloomer";

    private final TableSnapshotLoader loader;

    public DashboardService(TableSnapshotLoader loader) {
        this.loader = loader;
    }

    public DashboardDto dashboard() {
        TableSnapshot snapshot = loader.load(Sheets.STUDENTS, Sheets.PERFORMANCE, Sheets.WORKSHOPS);
        List<Student> students = snapshot.records(Sheets.STUDENTS, RecordMapper::student);
        List<PerformanceRecord> performance = snapshot.records(Sheets.PERFORMANCE, RecordMapper::performance);
        List<Course> workshops = snapshot.records(Sheets.WORKSHOPS, RecordMapper::course);

        SyntheticMetrics synthetic = new SyntheticMetrics();
        synthetic.mark("pendingReports");

        return DashboardDto.builder()
                .totalStudents(students.size())
                .boys(Aggregator.countEqual(students, Student::getGender, "Male"))
                .girls(Aggregator.countEqual(students, Student::getGender, "Female"))
                .brightLearners(Aggregator.countEqual(performance, PerformanceRecord::getCategory, BRIGHT_LEARNER))
                .lateBoomers(Aggregator.countEqual(performance, PerformanceRecord::getCategory, LATE_BLOOMER))
                .workshopsCompleted(Aggregator.countEqual(workshops, Course::getStatus, "Completed"))
                .pendingReports(FallbackPolicy.PENDING_REPORTS)
                .categories(Aggregator.countByLabels(students, Student::getCategory, CASTE_CATEGORIES).stream()
                        .map(c -> new CategoryCountDto(c.getLabel(), c.getCount()))
                        .collect(Collectors.toList()))
                .performance(Aggregator.countByLabels(performance, PerformanceRecord::getSummaryLabel, PERFORMANCE_LABELS).stream()
                        .map(c -> new CountDto(c.getLabel(), c.getCount()))
                        .collect(Collectors.toList()))
                .syntheticMetrics(synthetic.asList())
                .build();
    }
}
