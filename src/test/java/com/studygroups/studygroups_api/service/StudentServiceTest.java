package com.studygroups.studygroups_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.studygroups.studygroups_api.dto.StudentRequest;
import com.studygroups.studygroups_api.matching.TargetSizeResolver;
import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.Student;
import com.studygroups.studygroups_api.model.TimeSlot;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.StudentRepository;
import com.studygroups.studygroups_api.repository.TimeSlotRepository;

@ExtendWith(MockitoExtension.class)
class StudentServiceTest {

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private TimeSlotRepository timeSlotRepository;

    private StudentService studentService;

    @BeforeEach
    void setUp() {
        studentService = new StudentService(studentRepository, courseRepository, timeSlotRepository, new TargetSizeResolver());
    }

    private static Course course(String id) {
        Course course = new Course(id.toUpperCase(), "Course " + id);
        course.setId(id);
        return course;
    }

    private static TimeSlot slot(String id) {
        TimeSlot slot = new TimeSlot(id, null, null, null);
        slot.setId(id);
        return slot;
    }

    private void echoSave() {
        when(studentRepository.save(any(Student.class))).thenAnswer(invocation -> {
            Student student = invocation.getArgument(0);
            if (student.getId() == null) {
                student.setId("new-id");
            }
            return student;
        });
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("name and email are required")
        void requiresNameAndEmail() {
            assertThatThrownBy(() -> studentService.upsertStudent(new StudentRequest(" ", "a@b.c", 3, null, null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("name and email are required");
            assertThatThrownBy(() -> studentService.upsertStudent(new StudentRequest("Ann", null, 3, null, null)))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(studentRepository, never()).save(any());
        }

        @Test
        @DisplayName("unknown course ids are rejected")
        void unknownCourse() {
            when(courseRepository.findAllById(anyIterable())).thenReturn(List.of(course("c1")));

            assertThatThrownBy(() -> studentService.upsertStudent(
                    new StudentRequest("Ann", "ann@uni.edu", 3, List.of("c1", "nope"), null)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("unknown time slot ids are rejected")
        void unknownSlot() {
            when(timeSlotRepository.findAllById(anyIterable())).thenReturn(List.of());

            assertThatThrownBy(() -> studentService.upsertStudent(
                    new StudentRequest("Ann", "ann@uni.edu", 3, null, List.of("t9"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("t9");
        }
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("creates a new student with normalized email and clamped size")
        void createsStudent() {
            when(studentRepository.findByEmail("ann@uni.edu")).thenReturn(Optional.empty());
            when(courseRepository.findAllById(anyIterable())).thenReturn(List.of(course("c1")));
            when(timeSlotRepository.findAllById(anyIterable())).thenReturn(List.of(slot("t1"), slot("t2")));
            echoSave();

            Student saved = studentService.upsertStudent(new StudentRequest(
                    "  Ann  ", " Ann@Uni.EDU ", 9, List.of("c1", "c1"), List.of("t1", "t2", "t1")));

            assertThat(saved.getId()).isEqualTo("new-id");
            assertThat(saved.getName()).isEqualTo("Ann");
            assertThat(saved.getEmail()).isEqualTo("ann@uni.edu");
            assertThat(saved.getPreferredGroupSize()).isEqualTo(5);
            assertThat(saved.getCourseIds()).containsExactly("c1");
            assertThat(saved.getAvailabilityTimeslotIds()).containsExactly("t1", "t2");
            assertThat(saved.getCreatedAt()).isNotNull();
        }

        @Test
        @DisplayName("missing group size defaults to three")
        void defaultsGroupSize() {
            when(studentRepository.findByEmail("bob@uni.edu")).thenReturn(Optional.empty());
            echoSave();

            Student saved = studentService.upsertStudent(new StudentRequest("Bob", "bob@uni.edu", null, null, null));

            assertThat(saved.getPreferredGroupSize()).isEqualTo(3);
            assertThat(saved.getCourseIds()).isEmpty();
        }

        @Test
        @DisplayName("existing email replaces relations but keeps identity and creation time")
        void updatesExistingStudent() {
            Instant created = Instant.parse("2026-02-01T10:00:00Z");
            Student existing = new Student("Old Name", "ann@uni.edu", 4);
            existing.setId("s1");
            existing.setCreatedAt(created);
            existing.setCourseIds(new ArrayList<>(List.of("c1")));
            existing.setAvailabilityTimeslotIds(new ArrayList<>(List.of("t1")));
            when(studentRepository.findByEmail("ann@uni.edu")).thenReturn(Optional.of(existing));
            echoSave();

            Student saved = studentService.upsertStudent(new StudentRequest("Ann", "ann@uni.edu", 1, List.of(), List.of()));

            assertThat(saved.getId()).isEqualTo("s1");
            assertThat(saved.getCreatedAt()).isEqualTo(created);
            assertThat(saved.getName()).isEqualTo("Ann");
            assertThat(saved.getPreferredGroupSize()).isEqualTo(2);
            assertThat(saved.getCourseIds()).isEmpty();
            assertThat(saved.getAvailabilityTimeslotIds()).isEmpty();
        }
    }
}
