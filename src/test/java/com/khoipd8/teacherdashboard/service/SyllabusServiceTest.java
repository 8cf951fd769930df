package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.SyllabusDto;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyllabusServiceTest {

    private SyllabusDto syllabus(InMemoryTableStore store) {
        return new SyllabusService(store.loader(), new FallbackPolicy(new Random(11))).syllabus();
    }

    @Test
    void completionAndAllocationFollowUnitsAndTopicGroups() {
        InMemoryTableStore store = new InMemoryTableStore().sheet("Syllabus",
                List.of("Id", "Unit", "Name", "Expected", "Spent", "Status", "Start", "Done", "Group"), List.of(
                        row("T1", "Unit 1", "Sets", "4", "5", "Completed", "2024-01-08", "2024-01-12", "Algebra"),
                        row("T2", "Unit 1", "Functions", "3", "", "Pending", "2024-04-02", "", "Algebra"),
                        row("T3", "Unit 2", "Lines", "2 hrs", "", "Pending"),
                        row("T4", "Unit 2", "Angles", "6", "", "Pending", "2024-03-25")));

        SyllabusDto dto = syllabus(store);

        assertEquals(25, dto.getCompletionPercentage());
        assertEquals(1, dto.getCompletedUnits());
        assertEquals(2, dto.getTotalUnits());
        assertEquals(45, dto.getRemainingDays());
        assertEquals(4, dto.getTopics().size());

        assertEquals("Unit 1", dto.getUnitCompletion().get(0).getUnit());
        assertEquals(50, dto.getUnitCompletion().get(0).getPercentage());
        assertEquals(0, dto.getUnitCompletion().get(1).getPercentage());

        SyllabusDto.TimeAllocation algebra = dto.getTimeAllocation().get(0);
        assertEquals("Algebra", algebra.getTopic());
        assertEquals(7, algebra.getPlanned());
        assertEquals(5, algebra.getActual());

        SyllabusDto.TimeAllocation other = dto.getTimeAllocation().get(1);
        assertEquals("Other", other.getTopic());
        assertEquals(8, other.getPlanned());
        assertTrue(other.getActual() >= 6 && other.getActual() <= 9);
        assertTrue(dto.getSyntheticMetrics().contains("timeAllocation[1].actual"));
        assertFalse(dto.getSyntheticMetrics().contains("timeAllocation[0].actual"));

        assertEquals(List.of("T4", "T2", "T3"), dto.getUpcomingTopics().stream()
                .map(SyllabusDto.UpcomingTopic::getId).collect(Collectors.toList()));
        assertEquals("Next Week", dto.getUpcomingTopics().get(2).getPlannedStart());
        assertEquals("2024-03-25", dto.getUpcomingTopics().get(0).getPlannedStart());
    }

    @Test
    void emptySyllabusReportsZeroCompletion() {
        SyllabusDto dto = syllabus(new InMemoryTableStore().headerOnly("Syllabus"));

        assertEquals(0, dto.getCompletionPercentage());
        assertEquals(0, dto.getTotalUnits());
        assertTrue(dto.getUnitCompletion().isEmpty());
        assertTrue(dto.getUpcomingTopics().isEmpty());
    }

    @Test
    void upcomingTopicsAreCappedAtFive() {
        InMemoryTableStore store = new InMemoryTableStore().sheet("Syllabus", List.of("Id"), List.of(
                row("1", "U", "a", "1", "", "Pending"),
                row("2", "U", "b", "1", "", "Pending"),
                row("3", "U", "c", "1", "", "Pending"),
                row("4", "U", "d", "1", "", "Pending"),
                row("5", "U", "e", "1", "", "Pending"),
                row("6", "U", "f", "1", "", "Pending")));

        assertEquals(5, syllabus(store).getUpcomingTopics().size());
    }
}
