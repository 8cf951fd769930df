package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.DisciplineDto;
import com.khoipd8.teacherdashboard.model.Achievement;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.Sheets;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/** Class-wide discipline and achievement logs. */
@Service
public class StudentRecordService {

    private final TableSnapshotLoader loader;

    public StudentRecordService(TableSnapshotLoader loader) {
        this.loader = loader;
    }

    public List<DisciplineDto> discipline() {
        return loader.load(Sheets.DISCIPLINE).records(Sheets.DISCIPLINE, RecordMapper::discipline).stream()
                .map(d -> DisciplineDto.builder()
                        .id(d.getId())
                        .date(d.getDate())
                        .studentName(d.getStudentName())
                        .rollNo(d.getRollNo())
                        .description(d.getDescription())
                        .actionTaken(d.getAction())
                        .build())
                .collect(Collectors.toList());
    }

    public List<Achievement> achievements() {
        return loader.load(Sheets.ACHIEVEMENTS).records(Sheets.ACHIEVEMENTS, RecordMapper::achievement);
    }
}
