package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.model.AttendanceEntry;
import com.khoipd8.teacherdashboard.table.Percentages;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Placeholder values used when a dashboard metric has no sheet data behind it, so every widget
 * still renders. All ranges are inclusive.
 */
@Component
public class FallbackPolicy {

    public static final int DAILY_ATTENDANCE_MIN = 85;
    public static final int DAILY_ATTENDANCE_MAX = 94;
    public static final int WEEKLY_ATTENDANCE_DEFAULT = 90;
    public static final int STUDENT_ATTENDANCE_DEFAULT = 90;
    public static final double PRESENT_PROBABILITY = 0.85;

    public static final int PARTICIPANTS_MIN = 15;
    public static final int PARTICIPANTS_MAX = 44;

    public static final Map<String, Integer> GRADE_COUNTS;

    public static final String NEXT_ASSESSMENT_DATE = "Apr 15";
    public static final String NEXT_ASSESSMENT_NAME = "Unit Test 3";
    public static final int LAST_ASSESSMENT_AVERAGE = 76;
    public static final int MIN_TREND_POINTS = 3;

    /** Sample assessment averages appended when fewer than {@link #MIN_TREND_POINTS} are real. */
    public static final Map<String, Integer> SAMPLE_PERFORMANCE_TREND;

    public static final double ACTUAL_HOURS_MIN_FACTOR = 0.8;
    public static final double ACTUAL_HOURS_MAX_FACTOR = 1.2;

    public static final int REMAINING_TEACHING_DAYS = 45;
    public static final int PENDING_REPORTS = 3;

    public static final String NEXT_PTM_DATE = "Apr 20";
    public static final String NEXT_PTM_TIME = "09:00 AM";
    public static final String NEXT_PTM_DAY = "Saturday";

    static {
        Map<String, Integer> grades = new LinkedHashMap<>();
        grades.put("A", 5);
        grades.put("B", 12);
        grades.put("C", 18);
        grades.put("D", 8);
        grades.put("F", 2);
        GRADE_COUNTS = Collections.unmodifiableMap(grades);

        Map<String, Integer> trend = new LinkedHashMap<>();
        trend.put("Unit Test 1", 72);
        trend.put("Mid Term", 76);
        trend.put("Unit Test 2", 78);
        trend.put("Assignment 3", 82);
        SAMPLE_PERFORMANCE_TREND = Collections.unmodifiableMap(trend);
    }

    private final Random random;

    @Autowired
    public FallbackPolicy() {
        this(new Random());
    }

    public FallbackPolicy(Random random) {
        this.random = random;
    }

    public static List<String> gradeLabels() {
        return List.copyOf(GRADE_COUNTS.keySet());
    }

    /** Share of present marks on one day; a value from the daily band when nobody was marked. */
    public Estimate<Integer> dailyAttendance(long present, long marked) {
        if (marked > 0) {
            return Estimate.live(Percentages.of(present, marked, 0));
        }
        return Estimate.synthetic(attendanceBand());
    }

    /** Attendance of a parallel section; the workbook only tracks the teacher's own class. */
    public Estimate<Integer> otherClassAttendance() {
        return Estimate.synthetic(attendanceBand());
    }

    public Estimate<Integer> weeklyAttendance(long present, long marked) {
        if (marked > 0) {
            return Estimate.live(Percentages.of(present, marked, WEEKLY_ATTENDANCE_DEFAULT));
        }
        return Estimate.synthetic(WEEKLY_ATTENDANCE_DEFAULT);
    }

    public Estimate<Integer> studentAttendance(long presentMarks, long distinctDays) {
        if (distinctDays > 0) {
            return Estimate.live(Percentages.of(presentMarks, distinctDays, STUDENT_ATTENDANCE_DEFAULT));
        }
        return Estimate.synthetic(STUDENT_ATTENDANCE_DEFAULT);
    }

    /** Today's status from the sheet, or a draw that is "Present" with {@link #PRESENT_PROBABILITY}. */
    public Estimate<String> attendanceStatus(AttendanceEntry todayEntry) {
        if (todayEntry != null) {
            return Estimate.live(todayEntry.getStatus());
        }
        return Estimate.synthetic(random.nextDouble() < PRESENT_PROBABILITY ? "Present" : "Absent");
    }

    /** Head count of a workshop or course; scheduled sessions have nobody enrolled yet. */
    public Estimate<String> participants(String status) {
        if ("Scheduled".equals(status)) {
            return Estimate.live("0");
        }
        return Estimate.synthetic(String.valueOf(between(PARTICIPANTS_MIN, PARTICIPANTS_MAX)));
    }

    public Estimate<Integer> gradeCount(String grade, int actual) {
        if (actual > 0 || !GRADE_COUNTS.containsKey(grade)) {
            return Estimate.live(actual);
        }
        return Estimate.synthetic(GRADE_COUNTS.get(grade));
    }

    public Estimate<Integer> lastAssessmentAverage(Integer actual) {
        return actual != null ? Estimate.live(actual) : Estimate.synthetic(LAST_ASSESSMENT_AVERAGE);
    }

    /** Hours actually spent on a topic group; {@code floor(planned * u)} for u in [0.8, 1.2) when none were logged. */
    public Estimate<Integer> actualHours(int actual, int planned) {
        if (actual != 0) {
            return Estimate.live(actual);
        }
        double factor = ACTUAL_HOURS_MIN_FACTOR + random.nextDouble() * (ACTUAL_HOURS_MAX_FACTOR - ACTUAL_HOURS_MIN_FACTOR);
        return Estimate.synthetic((int) Math.floor(planned * factor));
    }

    private int attendanceBand() {
        return between(DAILY_ATTENDANCE_MIN, DAILY_ATTENDANCE_MAX);
    }

    private int between(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }
}
