package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.exception.ResourceNotFoundException;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.model.Teacher;
import com.khoipd8.teacherdashboard.table.JoinIndex;
import com.khoipd8.teacherdashboard.table.Sheets;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TeacherService {

    private final TableSnapshotLoader loader;

    public TeacherService(TableSnapshotLoader loader) {
        this.loader = loader;
    }

    /**
     * The teacher with the given employee id, or the first listed teacher when no id is given.
     *
     * @throws ResourceNotFoundException when an id is given and no row carries it
     * @throws IllegalStateException when no id is given and the sheet has no data rows
     */
    public Teacher teacher(String id) {
        List<Teacher> teachers = loader.load(Sheets.TEACHERS).records(Sheets.TEACHERS, RecordMapper::teacher);

        if (id != null && !id.isEmpty()) {
            return JoinIndex.on(teachers, Teacher::getId).findOne(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Teacher not found"));
        }
        if (teachers.isEmpty()) {
            throw new IllegalStateException("Teachers sheet has no data rows");
        }
        return teachers.get(0);
    }
}
