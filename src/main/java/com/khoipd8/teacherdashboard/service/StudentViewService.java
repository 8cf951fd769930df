package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CategoriesDto;
import com.khoipd8.teacherdashboard.dto.CategoryCountDto;
import com.khoipd8.teacherdashboard.dto.CountDto;
import com.khoipd8.teacherdashboard.dto.PerformanceDto;
import com.khoipd8.teacherdashboard.dto.StudentDetailsDto;
import com.khoipd8.teacherdashboard.exception.ResourceNotFoundException;
import com.khoipd8.teacherdashboard.model.Achievement;
import com.khoipd8.teacherdashboard.model.DisciplineRecord;
import com.khoipd8.teacherdashboard.model.PerformanceRecord;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.model.Student;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.LabelCount;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Student-centric views: enrollment list, category breakdowns, learner profiles and the merged
 * per-student record.
 */
@Service
public class StudentViewService {

    public static final List<String> SERVICE_CATEGORIES = List.of("1", "2", "3", "4", "5");

    static final String UNKNOWN = "Unknown";

    private final TableSnapshotLoader loader;

    public StudentViewService(TableSnapshotLoader loader) {
        this.loader = loader;
    }

    public List<Student> enrollment() {
        return loader.load(Sheets.STUDENTS).records(Sheets.STUDENTS, RecordMapper::student);
    }

    public CategoriesDto categories() {
        TableSnapshot snapshot = loader.load(Sheets.STUDENTS, Sheets.PERFORMANCE);
        List<Student> students = snapshot.records(Sheets.STUDENTS, RecordMapper::student);
        JoinIndex<PerformanceRecord> performanceByRollNo =
                JoinIndex.on(snapshot.records(Sheets.PERFORMANCE, RecordMapper::performance), PerformanceRecord::getId);

        List<LabelCount> caste = Aggregator.countByLabels(students, Student::getCategory, DashboardService.CASTE_CATEGORIES);

        List<CategoriesDto.CategoryBreakdown> detailed = new ArrayList<>();
        for (LabelCount category : caste) {
            List<Student> members = students.stream()
                    .filter(s -> Objects.equals(s.getCategory(), category.getLabel()))
                    .collect(Collectors.toList());
            detailed.add(CategoriesDto.CategoryBreakdown.builder()
                    .name(category.getLabel())
                    .total(category.getCount())
                    .boys(Aggregator.countEqual(members, Student::getGender, "Male"))
                    .girls(Aggregator.countEqual(members, Student::getGender, "Female"))
                    .brightLearners(Aggregator.countJoined(members, Student::getRollNo, performanceByRollNo,
                            p -> DashboardService.BRIGHT_LEARNER.equals(p.getCategory())))
                    .lateBoomers(Aggregator.countJoined(members, Student::getRollNo, performanceByRollNo,
                            p -> DashboardService.LATE_BLOOMER.equals(p.getCategory())))
                    .build());
        }

        return CategoriesDto.builder()
                .casteCategories(caste.stream()
                        .map(c -> new CountDto(c.getLabel(), c.getCount()))
                        .collect(Collectors.toList()))
                .serviceCategories(Aggregator.countByLabels(students, Student::getServiceCategory, SERVICE_CATEGORIES).stream()
                        .map(c -> new CategoryCountDto(c.getLabel(), c.getCount()))
                        .collect(Collectors.toList()))
                .detailedCategories(detailed)
                .build();
    }

    public PerformanceDto performance() {
        TableSnapshot snapshot = loader.load(Sheets.PERFORMANCE, Sheets.STUDENTS);
        List<PerformanceRecord> performance = snapshot.records(Sheets.PERFORMANCE, RecordMapper::performance);
        JoinIndex<Student> studentsByRollNo =
                JoinIndex.on(snapshot.records(Sheets.STUDENTS, RecordMapper::student), Student::getRollNo);

        return PerformanceDto.builder()
                .brightLearners(profiles(performance, DashboardService.BRIGHT_LEARNER, studentsByRollNo))
                .lateBoomers(profiles(performance, DashboardService.LATE_BLOOMER, studentsByRollNo))
                .build();
    }

    private List<PerformanceDto.LearnerProfile> profiles(List<PerformanceRecord> performance, String category,
                                                         JoinIndex<Student> studentsByRollNo) {
        List<PerformanceDto.LearnerProfile> profiles = new ArrayList<>();
        for (PerformanceRecord record : performance) {
            if (!category.equals(record.getCategory())) {
                continue;
            }
            Student student = studentsByRollNo.findOne(record.getId()).orElse(null);
            profiles.add(PerformanceDto.LearnerProfile.builder()
                    .id(record.getId())
                    .rollNo(record.getId())
                    .name(orUnknown(student == null ? null : student.getName()))
                    .className(orUnknown(student == null ? null : student.getClassName()))
                    .category(orUnknown(student == null ? null : student.getCategory()))
                    .serviceCategory(orUnknown(student == null ? null : student.getServiceCategory()))
                    .strengths(record.getStrengths())
                    .weaknesses(record.getWeaknesses())
                    .build());
        }
        return profiles;
    }

    public StudentDetailsDto studentDetails(String rollNo) {
        TableSnapshot snapshot = loader.load(Sheets.STUDENTS, Sheets.PERFORMANCE, Sheets.DISCIPLINE, Sheets.ACHIEVEMENTS);

        Student student = JoinIndex.on(snapshot.records(Sheets.STUDENTS, RecordMapper::student), Student::getRollNo)
                .findOne(rollNo)
                .orElseThrow(() -> new ResourceNotFoundException("Student not found"));

        PerformanceRecord performance = JoinIndex.on(
                        snapshot.records(Sheets.PERFORMANCE, RecordMapper::performance), PerformanceRecord::getId)
                .findOne(rollNo)
                .orElse(null);

        List<StudentDetailsDto.DisciplineNote> discipline = JoinIndex.on(
                        snapshot.records(Sheets.DISCIPLINE, RecordMapper::discipline), DisciplineRecord::getRollNo)
                .findAll(rollNo).stream()
                .map(d -> StudentDetailsDto.DisciplineNote.builder()
                        .id(d.getId())
                        .date(d.getDate())
                        .incident(d.getDescription())
                        .action(d.getAction())
                        .build())
                .collect(Collectors.toList());

        // achievements carry the student's name, not the roll number
        List<String> achievements = JoinIndex.on(
                        snapshot.records(Sheets.ACHIEVEMENTS, RecordMapper::achievement), Achievement::getStudentName)
                .findAll(student.getName()).stream()
                .map(Achievement::getTitle)
                .collect(Collectors.toList());

        return StudentDetailsDto.builder()
                .rollNo(student.getRollNo())
                .name(student.getName())
                .gender(student.getGender())
                .category(student.getCategory())
                .serviceCategory(student.getServiceCategory())
                .contact(student.getContact())
                .className(student.getClassName())
                .performanceReport(performance != null
                        ? performance.getReport()
                        : Sheets.PERFORMANCE.defaultAt(Sheets.PERFORMANCE.indexOf("report")))
                .strengths(performance != null ? performance.getStrengths() : Collections.emptyList())
                .weaknesses(performance != null ? performance.getWeaknesses() : Collections.emptyList())
                .suggestions(performance != null ? performance.getSuggestions() : Collections.emptyList())
                .disciplineRecords(discipline)
                .achievements(achievements)
                .build();
    }

    private static String orUnknown(String value) {
        return value == null ? UNKNOWN : value;
    }
}
