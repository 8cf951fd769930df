package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.AttendanceDto;
import com.khoipd8.teacherdashboard.model.AttendanceEntry;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.model.Student;
import com.khoipd8.teacherdashboard.table.Aggregator;
import com.khoipd8.teacherdashboard.table.CellValues;
import com.khoipd8.teacherdashboard.table.DateWindows;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Daily, weekly and per-student attendance. Attendance rows are matched to days by their
 * ISO date text, so a row dated {@code 2024/03/05} counts for {@code 2024-03-05}.
 */
@Service
public class AttendanceService {

    public static final int TREND_DAYS = 7;
    public static final int LOW_ATTENDANCE_THRESHOLD = 75;
    public static final String OWN_CLASS = "X-A";
    public static final List<String> OTHER_CLASSES = List.of("X-B", "X-C", "X-D");

    static final String PRESENT = "Present";

    private final TableSnapshotLoader loader;
    private final FallbackPolicy fallbackPolicy;
    private final Clock clock;

    public AttendanceService(TableSnapshotLoader loader, FallbackPolicy fallbackPolicy, Clock clock) {
        this.loader = loader;
        this.fallbackPolicy = fallbackPolicy;
        this.clock = clock;
    }

    public AttendanceDto attendance() {
        TableSnapshot snapshot = loader.load(Sheets.ATTENDANCE, Sheets.STUDENTS);
        List<AttendanceEntry> attendance = snapshot.records(Sheets.ATTENDANCE, RecordMapper::attendance);
        List<Student> students = snapshot.records(Sheets.STUDENTS, RecordMapper::student);

        LocalDate today = LocalDate.now(clock);
        String todayIso = today.toString();
        SyntheticMetrics synthetic = new SyntheticMetrics();

        List<AttendanceEntry> todayEntries = onDays(attendance, Set.of(todayIso));
        int presentToday = Aggregator.countEqual(todayEntries, AttendanceEntry::getStatus, PRESENT);

        List<AttendanceEntry> lastWeek = onDays(attendance, DateWindows.lastDaysIso(today, TREND_DAYS));
        int weeklyAverage = synthetic.take("weeklyAverage", fallbackPolicy.weeklyAttendance(
                Aggregator.countEqual(lastWeek, AttendanceEntry::getStatus, PRESENT), lastWeek.size()));

        List<AttendanceDto.TrendPoint> trend = new ArrayList<>(TREND_DAYS);
        List<LocalDate> days = DateWindows.lastDays(today, TREND_DAYS);
        for (int i = days.size() - 1; i >= 0; i--) {
            LocalDate day = days.get(i);
            List<AttendanceEntry> dayEntries = onDays(attendance, Set.of(day.toString()));
            int percentage = synthetic.take("attendanceTrend[" + trend.size() + "].percentage",
                    fallbackPolicy.dailyAttendance(
                            Aggregator.countEqual(dayEntries, AttendanceEntry::getStatus, PRESENT), dayEntries.size()));
            trend.add(new AttendanceDto.TrendPoint(day.getMonthValue() + "/" + day.getDayOfMonth(), percentage));
        }

        List<AttendanceDto.ClassAttendance> classComparison = new ArrayList<>();
        classComparison.add(new AttendanceDto.ClassAttendance(OWN_CLASS, weeklyAverage));
        if (lastWeek.isEmpty()) {
            synthetic.mark("classComparison[0].percentage");
        }
        for (String otherClass : OTHER_CLASSES) {
            classComparison.add(new AttendanceDto.ClassAttendance(otherClass, synthetic.take(
                    "classComparison[" + classComparison.size() + "].percentage",
                    fallbackPolicy.otherClassAttendance())));
        }

        JoinIndex<AttendanceEntry> byStudent = JoinIndex.on(attendance, AttendanceEntry::getStudentId);
        JoinIndex<AttendanceEntry> todayByStudent = JoinIndex.on(todayEntries, AttendanceEntry::getStudentId);
        List<AttendanceDto.StudentAttendance> rollup = new ArrayList<>(students.size());
        for (Student student : students) {
            rollup.add(studentAttendance(student, byStudent, todayByStudent, rollup.size(), synthetic));
        }

        return AttendanceDto.builder()
                .presentToday(presentToday)
                .totalStudents(students.size())
                .weeklyAverage(weeklyAverage)
                .belowThreshold(Aggregator.countMatching(rollup, s -> s.getPercentage() < LOW_ATTENDANCE_THRESHOLD))
                .attendanceTrend(trend)
                .classComparison(classComparison)
                .students(rollup)
                .syntheticMetrics(synthetic.asList())
                .build();
    }

    private AttendanceDto.StudentAttendance studentAttendance(Student student,
                                                              JoinIndex<AttendanceEntry> byStudent,
                                                              JoinIndex<AttendanceEntry> todayByStudent,
                                                              int position,
                                                              SyntheticMetrics synthetic) {
        List<AttendanceEntry> entries = byStudent.findAll(student.getRollNo());
        int totalDays = Aggregator.distinctCount(entries, e -> CellValues.isoDate(e.getDate()));
        int presentDays = Aggregator.countEqual(entries, AttendanceEntry::getStatus, PRESENT);
        AttendanceEntry todayEntry = todayByStudent.findOne(student.getRollNo()).orElse(null);

        String path = "students[" + position + "]";
        return AttendanceDto.StudentAttendance.builder()
                .rollNo(student.getRollNo())
                .name(student.getName())
                .status(synthetic.take(path + ".status", fallbackPolicy.attendanceStatus(todayEntry)))
                .remarks(todayEntry != null ? todayEntry.getRemarks() : "")
                .totalPresent(presentDays)
                .totalDays(totalDays)
                .percentage(synthetic.take(path + ".percentage",
                        fallbackPolicy.studentAttendance(presentDays, totalDays)))
                .build();
    }

    private static List<AttendanceEntry> onDays(List<AttendanceEntry> attendance, Set<String> isoDays) {
        return attendance.stream()
                .filter(e -> e.getDate() != null && isoDays.contains(CellValues.isoDate(e.getDate())))
                .collect(Collectors.toList());
    }
}
