package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.DisciplineDto;
import com.khoipd8.teacherdashboard.model.Achievement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.khoipd8.teacherdashboard.service.InMemoryTableStore.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class StudentRecordServiceTest {

    private final InMemoryTableStore store = new InMemoryTableStore()
            .sheet("Discipline", List.of("Id", "Date", "Student", "Roll", "Description", "Action"), List.of(
                    row("D1", "2024-02-01", "Ravi", "102", "Late to class"),
                    row("D2", "2024-02-09", "Ravi", "102", "Phone in class", "Detention")))
            .sheet("Achievements", List.of("Id", "Date", "Student", "Title", "Description"), List.of(
                    row("A1", "2024-01-15", "Asha", "Spelling Bee")));

    private final StudentRecordService service = new StudentRecordService(store.loader());

    @Test
    void disciplineReportsActionTakenWithDefault() {
        List<DisciplineDto> discipline = service.discipline();

        assertEquals(2, discipline.size());
        assertEquals("Verbal Warning", discipline.get(0).getActionTaken());
        assertEquals("Detention", discipline.get(1).getActionTaken());
        assertEquals("102", discipline.get(1).getRollNo());
    }

    @Test
    void achievementsKeepMissingDescriptionAsNull() {
        List<Achievement> achievements = service.achievements();

        assertEquals("Spelling Bee", achievements.get(0).getTitle());
        assertNull(achievements.get(0).getDescription());
    }
}
