package com.khoipd8.teacherdashboard.model;

import com.khoipd8.teacherdashboard.table.MappedRow;

/**
 * Builds the typed record for each sheet from a row already resolved against its schema
 * (see {@link com.khoipd8.teacherdashboard.table.Sheets}).
 */
public final class RecordMapper {

    private RecordMapper() {
    }

    public static AuthenticationEntry authentication(MappedRow row) {
        return AuthenticationEntry.builder()
                .id(row.get("id"))
                .token(row.get("token"))
                .build();
    }

    public static Teacher teacher(MappedRow row) {
        return Teacher.builder()
                .id(row.get("id"))
                .name(row.get("name"))
                .subject(row.get("subject"))
                .className(row.get("class"))
                .department(row.get("department"))
                .build();
    }

    public static Student student(MappedRow row) {
        return Student.builder()
                .rollNo(row.get("rollNo"))
                .name(row.get("name"))
                .gender(row.get("gender"))
                .category(row.get("category"))
                .serviceCategory(row.get("serviceCategory"))
                .contact(row.get("contact"))
                .status(row.get("status"))
                .className(row.get("class"))
                .build();
    }

    public static PerformanceRecord performance(MappedRow row) {
        return PerformanceRecord.builder()
                .id(row.get("id"))
                .summaryLabel(row.get("summaryLabel"))
                .category(row.get("category"))
                .strengths(row.getList("strengths"))
                .weaknesses(row.getList("weaknesses"))
                .suggestions(row.getList("suggestions"))
                .report(row.get("report"))
                .remarks(row.get("remarks"))
                .build();
    }

    public static Course course(MappedRow row) {
        return Course.builder()
                .id(row.get("id"))
                .title(row.get("title"))
                .duration(row.get("duration"))
                .status(row.get("status"))
                .sessionDates(row.getList("sessionDates"))
                .sessionTopics(row.getList("sessionTopics"))
                .build();
    }

    public static DisciplineRecord discipline(MappedRow row) {
        return DisciplineRecord.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .studentName(row.get("studentName"))
                .rollNo(row.get("rollNo"))
                .description(row.get("description"))
                .action(row.get("action"))
                .build();
    }

    public static Achievement achievement(MappedRow row) {
        return Achievement.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .studentName(row.get("studentName"))
                .title(row.get("title"))
                .description(row.get("description"))
                .build();
    }

    public static AttendanceEntry attendance(MappedRow row) {
        return AttendanceEntry.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .studentId(row.get("studentId"))
                .status(row.get("status"))
                .remarks(row.get("remarks"))
                .build();
    }

    public static Assessment assessment(MappedRow row) {
        return Assessment.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .title(row.get("title"))
                .type(row.get("type"))
                .maxScore(row.get("maxScore"))
                .status(row.get("status"))
                .build();
    }

    public static Grade grade(MappedRow row) {
        return Grade.builder()
                .assessmentId(row.get("assessmentId"))
                .studentId(row.get("studentId"))
                .score(row.get("score"))
                .percentage(row.get("percentage"))
                .grade(row.get("grade"))
                .build();
    }

    public static SyllabusTopic syllabusTopic(MappedRow row) {
        return SyllabusTopic.builder()
                .id(row.get("id"))
                .unit(row.get("unit"))
                .name(row.get("name"))
                .expectedHours(row.get("expectedHours"))
                .timeSpent(row.get("timeSpent"))
                .status(row.get("status"))
                .startDate(row.get("startDate"))
                .completionDate(row.get("completionDate"))
                .topicGroup(row.get("topicGroup"))
                .build();
    }

    public static CalendarEvent event(MappedRow row) {
        return CalendarEvent.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .title(row.get("title"))
                .type(row.get("type"))
                .time(row.get("time"))
                .description(row.get("description"))
                .build();
    }

    public static CommunicationLog communication(MappedRow row) {
        return CommunicationLog.builder()
                .id(row.get("id"))
                .date(row.get("date"))
                .student(row.get("student"))
                .parent(row.get("parent"))
                .type(row.get("type"))
                .subject(row.get("subject"))
                .status(row.get("status"))
                .build();
    }

    public static ParentContact parent(MappedRow row) {
        return ParentContact.builder()
                .id(row.get("id"))
                .student(row.get("student"))
                .name(row.get("name"))
                .relation(row.get("relation"))
                .phone(row.get("phone"))
                .email(row.get("email"))
                .lastContact(row.get("lastContact"))
                .build();
    }
}
