package com.studygroups.studygroups_api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import com.studygroups.studygroups_api.matching.RosterProvider;
import com.studygroups.studygroups_api.matching.StudentProfile;
import com.studygroups.studygroups_api.matching.TargetSizeResolver;
import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.Student;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.StudentRepository;

/**
 * Builds course rosters from MongoDB. Courses iterate by code and each roster lists
 * students by creation time, then id, so repeated runs see the same order.
 */
@Component
public class MongoRosterProvider implements RosterProvider {

    private static final Logger logger = LoggerFactory.getLogger(MongoRosterProvider.class);

    static final Sort COURSE_ORDER = Sort.by(Sort.Direction.ASC, "code", "id");
    static final Sort STUDENT_ORDER = Sort.by(Sort.Direction.ASC, "createdAt", "id");

    private final CourseRepository courseRepository;
    private final StudentRepository studentRepository;
    private final TargetSizeResolver targetSizeResolver;

    public MongoRosterProvider(CourseRepository courseRepository, StudentRepository studentRepository,
                               TargetSizeResolver targetSizeResolver) {
        this.courseRepository = courseRepository;
        this.studentRepository = studentRepository;
        this.targetSizeResolver = targetSizeResolver;
    }

    @Override
    public Map<String, List<StudentProfile>> loadRosters() {
        List<Course> courses = courseRepository.findAll(COURSE_ORDER);
        List<Student> students = studentRepository.findAll(STUDENT_ORDER);
        if (students.isEmpty()) {
            return new LinkedHashMap<>();
        }

        Map<String, List<StudentProfile>> byCourse = new LinkedHashMap<>();
        for (Course course : courses) {
            byCourse.put(course.getId(), new ArrayList<>());
        }

        for (Student student : students) {
            if (student.getCourseIds() == null || student.getCourseIds().isEmpty()) {
                continue;
            }
            StudentProfile profile = toProfile(student);
            for (String courseId : new LinkedHashSet<>(student.getCourseIds())) {
                List<StudentProfile> roster = byCourse.get(courseId);
                if (roster == null) {
                    logger.warn("Student {} is enrolled in unknown course {}; skipping enrollment", student.getId(), courseId);
                    continue;
                }
                roster.add(profile);
            }
        }

        byCourse.values().removeIf(List::isEmpty);
        logger.info("Loaded rosters for {} courses from {} students", byCourse.size(), students.size());
        return byCourse;
    }

    private StudentProfile toProfile(Student student) {
        int stored = student.getPreferredGroupSize();
        int clamped = targetSizeResolver.clamp(stored);
        if (clamped != stored) {
            logger.warn("Student {} has preferred group size {}; clamped to {}", student.getId(), stored, clamped);
        }
        Set<String> slots = student.getAvailabilityTimeslotIds() == null
                ? Set.of()
                : new LinkedHashSet<>(student.getAvailabilityTimeslotIds());
        return new StudentProfile(student.getId(), clamped, slots);
    }
}
