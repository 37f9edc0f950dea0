package com.studygroups.studygroups_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import com.studygroups.studygroups_api.dto.StudentRequest;
import com.studygroups.studygroups_api.matching.TargetSizeResolver;
import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.Student;
import com.studygroups.studygroups_api.model.TimeSlot;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.StudentRepository;
import com.studygroups.studygroups_api.repository.TimeSlotRepository;

@Service
public class StudentService {

    private static final Logger logger = LoggerFactory.getLogger(StudentService.class);

    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final TimeSlotRepository timeSlotRepository;
    private final TargetSizeResolver targetSizeResolver;

    public StudentService(StudentRepository studentRepository, CourseRepository courseRepository,
                          TimeSlotRepository timeSlotRepository, TargetSizeResolver targetSizeResolver) {
        this.studentRepository = studentRepository;
        this.courseRepository = courseRepository;
        this.timeSlotRepository = timeSlotRepository;
        this.targetSizeResolver = targetSizeResolver;
    }

    public List<Student> getAllStudents() {
        return studentRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }

    /**
     * Creates the student, or replaces name, group size, courses and availability of the
     * student already registered under the same email.
     */
    public Student upsertStudent(StudentRequest request) {
        String name = request.name() == null ? "" : request.name().trim();
        String email = request.email() == null ? "" : request.email().trim().toLowerCase();
        if (name.isEmpty() || email.isEmpty()) {
            throw new IllegalArgumentException("name and email are required");
        }

        int requestedSize = request.preferredGroupSize() == null
                ? targetSizeResolver.getDefaultSize()
                : request.preferredGroupSize();
        int preferredGroupSize = targetSizeResolver.clamp(requestedSize);

        List<String> courseIds = validateCourseIds(request.courseIds());
        List<String> timeslotIds = validateTimeslotIds(request.availabilityTimeslotIds());

        Student student = studentRepository.findByEmail(email).orElseGet(() -> {
            Student created = new Student();
            created.setEmail(email);
            created.setCreatedAt(Instant.now());
            return created;
        });
        boolean isNew = student.getId() == null;

        student.setName(name);
        student.setPreferredGroupSize(preferredGroupSize);
        student.setCourseIds(courseIds);
        student.setAvailabilityTimeslotIds(timeslotIds);

        Student saved = studentRepository.save(student);
        logger.info("{} student {} ({} courses, {} available slots)",
                isNew ? "Created" : "Updated", saved.getId(), courseIds.size(), timeslotIds.size());
        return saved;
    }

    private List<String> validateCourseIds(List<String> requested) {
        Set<String> ids = distinct(requested);
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> known = courseRepository.findAllById(ids).stream()
                .map(Course::getId)
                .collect(Collectors.toSet());
        for (String id : ids) {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("Course with ID " + id + " not found.");
            }
        }
        return new ArrayList<>(ids);
    }

    private List<String> validateTimeslotIds(List<String> requested) {
        Set<String> ids = distinct(requested);
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        Set<String> known = timeSlotRepository.findAllById(ids).stream()
                .map(TimeSlot::getId)
                .collect(Collectors.toSet());
        for (String id : ids) {
            if (!known.contains(id)) {
                throw new IllegalArgumentException("Time slot with ID " + id + " not found.");
            }
        }
        return new ArrayList<>(ids);
    }

    private static Set<String> distinct(List<String> ids) {
        Set<String> result = new LinkedHashSet<>();
        if (ids != null) {
            for (String id : ids) {
                if (id != null && !id.isBlank()) {
                    result.add(id.trim());
                }
            }
        }
        return result;
    }
}
