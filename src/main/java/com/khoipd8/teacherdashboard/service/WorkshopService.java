package com.khoipd8.teacherdashboard.service;

import com.khoipd8.teacherdashboard.dto.WorkshopsDto;
import com.khoipd8.teacherdashboard.model.Course;
import com.khoipd8.teacherdashboard.model.RecordMapper;
import com.khoipd8.teacherdashboard.table.Sheets;
import com.khoipd8.teacherdashboard.table.TableSnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class WorkshopService {

    static final String WORKSHOP_TOPIC_DEFAULT = "General Discussion";
    static final String COURSE_TOPIC_DEFAULT = "General Course Content";

    private final TableSnapshotLoader loader;
    private final FallbackPolicy fallbackPolicy;

    public WorkshopService(TableSnapshotLoader loader, FallbackPolicy fallbackPolicy) {
        this.loader = loader;
        this.fallbackPolicy = fallbackPolicy;
    }

    public WorkshopsDto workshops() {
        TableSnapshot snapshot = loader.load(Sheets.WORKSHOPS, Sheets.SERVICE_COURSES);
        SyntheticMetrics synthetic = new SyntheticMetrics();

        return WorkshopsDto.builder()
                .workshops(summaries("workshops", snapshot.records(Sheets.WORKSHOPS, RecordMapper::course),
                        WORKSHOP_TOPIC_DEFAULT, synthetic))
                .serviceCourses(summaries("serviceCourses", snapshot.records(Sheets.SERVICE_COURSES, RecordMapper::course),
                        COURSE_TOPIC_DEFAULT, synthetic))
                .syntheticMetrics(synthetic.asList())
                .build();
    }

    private List<WorkshopsDto.CourseSummary> summaries(String path, List<Course> courses, String defaultTopic,
                                                       SyntheticMetrics synthetic) {
        List<WorkshopsDto.CourseSummary> summaries = new ArrayList<>(courses.size());
        for (int i = 0; i < courses.size(); i++) {
            Course course = courses.get(i);
            summaries.add(WorkshopsDto.CourseSummary.builder()
                    .id(course.getId())
                    .title(course.getTitle())
                    .duration(course.getDuration())
                    .status(course.getStatus())
                    .participants(synthetic.take(path + "[" + i + "].participants",
                            fallbackPolicy.participants(course.getStatus())))
                    .sessions(sessions(course, defaultTopic))
                    .build());
        }
        return summaries;
    }

    /** One session per listed date; topics pair up by position. */
    static List<WorkshopsDto.Session> sessions(Course course, String defaultTopic) {
        List<String> dates = course.getSessionDates();
        List<String> topics = course.getSessionTopics();
        List<WorkshopsDto.Session> sessions = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            String topic = i < topics.size() ? topics.get(i) : "";
            sessions.add(new WorkshopsDto.Session(dates.get(i), topic.isEmpty() ? defaultTopic : topic));
        }
        return sessions;
    }
}
