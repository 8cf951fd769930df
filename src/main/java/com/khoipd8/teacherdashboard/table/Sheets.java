package com.khoipd8.teacherdashboard.table;

/**
 * Column layouts of every sheet in the class workbook.
 */
public final class Sheets {

    public static final TableSchema AUTHENTICATION = TableSchema.sheet("Authentication")
            .column("id")
            .column("token")
            .build();

    public static final TableSchema TEACHERS = TableSchema.sheet("Teachers")
            .column("id")
            .column("name")
            .column("subject")
            .column("class")
            .column("department", "General")
            .build();

    public static final TableSchema STUDENTS = TableSchema.sheet("Students")
            .column("rollNo")
            .column("name")
            .column("gender")
            .column("category")
            .column("serviceCategory")
            .column("contact")
            .column("status", "Active")
            .column("class", "X-A")
            .build();

    public static final TableSchema PERFORMANCE = TableSchema.sheet("Performance")
            .column("id")
            .column("summaryLabel")
            .column("category")
            .column("strengths")
            .column("weaknesses")
            .column("suggestions")
            .column("report", "The student shows consistent effort in academics.")
            .column("remarks")
            .build();

    public static final TableSchema WORKSHOPS = courseSheet("Workshops");

    public static final TableSchema SERVICE_COURSES = courseSheet("ServiceCourses");

    public static final TableSchema DISCIPLINE = TableSchema.sheet("Discipline")
            .column("id")
            .column("date")
            .column("studentName")
            .column("rollNo")
            .column("description")
            .column("action", "Verbal Warning")
            .build();

    public static final TableSchema ACHIEVEMENTS = TableSchema.sheet("Achievements")
            .column("id")
            .column("date")
            .column("studentName")
            .column("title")
            .column("description")
            .build();

    public static final TableSchema ATTENDANCE = TableSchema.sheet("Attendance")
            .column("id")
            .column("date")
            .column("studentId")
            .column("status")
            .column("remarks")
            .build();

    public static final TableSchema ASSESSMENTS = TableSchema.sheet("Assessments")
            .column("id")
            .column("date")
            .column("title")
            .column("type")
            .column("maxScore")
            .column("status")
            .build();

    public static final TableSchema GRADES = TableSchema.sheet("Grades")
            .column("assessmentId")
            .column("studentId")
            .column("score")
            .column("percentage")
            .column("grade")
            .build();

    public static final TableSchema SYLLABUS = TableSchema.sheet("Syllabus")
            .column("id")
            .column("unit")
            .column("name")
            .column("expectedHours")
            .column("timeSpent")
            .column("status")
            .column("startDate")
            .column("completionDate")
            .column("topicGroup", "Other")
            .build();

    public static final TableSchema EVENTS = TableSchema.sheet("Events")
            .column("id")
            .column("date")
            .column("title")
            .column("type")
            .column("time", "All Day")
            .column("description", "")
            .build();

    public static final TableSchema COMMUNICATIONS = TableSchema.sheet("Communications")
            .column("id")
            .column("date")
            .column("student")
            .column("parent")
            .column("type")
            .column("subject")
            .column("status")
            .build();

    public static final TableSchema PARENTS = TableSchema.sheet("Parents")
            .column("id")
            .column("student")
            .column("name")
            .column("relation")
            .column("phone")
            .column("email")
            .column("lastContact")
            .build();

    private Sheets() {
    }

    private static TableSchema courseSheet(String name) {
        return TableSchema.sheet(name)
                .column("id")
                .column("title")
                .column("duration")
                .column("status")
                .column("sessionDates")
                .column("sessionTopics")
                .build();
    }
}
