package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.CategoriesDto;
import com.khoipd8.teacherdashboard.dto.PerformanceDto;
import com.khoipd8.teacherdashboard.dto.StudentDetailsDto;
import com.khoipd8.teacherdashboard.exception.ResourceNotFoundException;
import com.khoipd8.teacherdashboard.model.Student;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StudentViewServiceTest {

    private InMemoryTableStore store;
    private StudentViewService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryTableStore()
                .sheet("Students", List.of("Roll", "Name", "Gender", "Category", "Service", "Contact", "Status"), List.of(
                        row("101", "Asha", "Female", "OBC", "2", "999", "Active"),
                        row("102", "Ravi", "Male", "OBC", "5", "888", "", "X-B"),
                        row("103", "Meena", "Female", "General", "9")))
                .sheet("Performance", List.of("Id", "Label", "Category", "Strengths", "Weaknesses", "Suggestions"), List.of(
                        row("101", "Good", "Bright Learner", "Focus,Speed", "Grammar", ""),
                        row("102", "Average", "Late Bloomer", "", "Algebra, Geometry", "Practice", "Needs steady practice."),
                        row("999", "Good", "Late Bloomer")))
                .sheet("Discipline", List.of("Id", "Date", "Student", "Roll", "Description"), List.of(
                        row("D1", "2024-02-01", "Ravi", "102", "Late to class"),
                        row("D2", "2024-02-09", "Ravi", "102", "Phone in class", "Parent called")))
                .sheet("Achievements", List.of("Id", "Date", "Student", "Title"), List.of(
                        row("A1", "2024-01-15", "Ravi", "Science Fair Winner"),
                        row("A2", "2024-01-20", "Asha", "Spelling Bee")));
        service = new StudentViewService(store.loader());
    }

    @Test
    void brightLearnerJoinsStudentByRollNumber() {
        PerformanceDto performance = service.performance();

        assertEquals(1, performance.getBrightLearners().size());
        PerformanceDto.LearnerProfile asha = performance.getBrightLearners().get(0);
        assertEquals("101", asha.getRollNo());
        assertEquals("Asha", asha.getName());
        assertEquals("X-A", asha.getClassName());
        assertEquals("OBC", asha.getCategory());
        assertEquals(List.of("Focus", "Speed"), asha.getStrengths());
        assertEquals(List.of("Grammar"), asha.getWeaknesses());
    }

    @Test
    void learnerWithoutEnrollmentIsUnknown() {
        PerformanceDto.LearnerProfile orphan = service.performance().getLateBoomers().get(1);

        assertEquals("999", orphan.getId());
        assertEquals("Unknown", orphan.getName());
        assertEquals("Unknown", orphan.getClassName());
        assertTrue(orphan.getStrengths().isEmpty());
    }

    @Test
    void enrollmentAppliesDefaults() {
        List<Student> students = service.enrollment();

        assertEquals(3, students.size());
        assertEquals("Active", students.get(1).getStatus());
        assertEquals("X-B", students.get(1).getClassName());
    }

    @Test
    void categoriesUseFixedLabelsAndCrossTableProbe() {
        CategoriesDto categories = service.categories();

        assertEquals(5, categories.getCasteCategories().size());
        assertEquals("General", categories.getCasteCategories().get(0).getName());
        assertEquals(1, categories.getCasteCategories().get(0).getCount());
        assertEquals(2, categories.getCasteCategories().get(1).getCount());

        // service category "9" is outside the fixed set and is not reported
        int serviceTotal = categories.getServiceCategories().stream().mapToInt(c -> c.getCount()).sum();
        assertEquals(2, serviceTotal);

        CategoriesDto.CategoryBreakdown obc = categories.getDetailedCategories().get(1);
        assertEquals("OBC", obc.getName());
        assertEquals(2, obc.getTotal());
        assertEquals(1, obc.getBoys());
        assertEquals(1, obc.getGirls());
        assertEquals(1, obc.getBrightLearners());
        assertEquals(1, obc.getLateBoomers());
    }

    @Test
    void studentDetailsMergeEverySheet() {
        StudentDetailsDto ravi = service.studentDetails("102");

        assertEquals("X-B", ravi.getClassName());
        assertEquals("Needs steady practice.", ravi.getPerformanceReport());
        assertEquals(List.of("Algebra", "Geometry"), ravi.getWeaknesses());
        assertEquals(List.of("Practice"), ravi.getSuggestions());
        assertEquals(2, ravi.getDisciplineRecords().size());
        assertEquals("Late to class", ravi.getDisciplineRecords().get(0).getIncident());
        assertEquals("Verbal Warning", ravi.getDisciplineRecords().get(0).getAction());
        assertEquals("Parent called", ravi.getDisciplineRecords().get(1).getAction());
        assertEquals(List.of("Science Fair Winner"), ravi.getAchievements());
    }

    @Test
    void studentWithoutPerformanceRowGetsDefaultReport() {
        StudentDetailsDto meena = service.studentDetails("103");

        assertEquals("The student shows consistent effort in academics.", meena.getPerformanceReport());
        assertTrue(meena.getStrengths().isEmpty());
        assertTrue(meena.getDisciplineRecords().isEmpty());
    }

    @Test
    void unknownRollNumberIsNotFound() {
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class, () -> service.studentDetails("404"));

        assertEquals("Student not found", e.getMessage());
    }

    @Test
    void fetchesFullSchemaWidth() {
        service.studentDetails("101");

        assertTrue(store.fetchedRanges().contains("Discipline!A:F"));
        assertTrue(store.fetchedRanges().contains("Students!A:H"));
    }
}
