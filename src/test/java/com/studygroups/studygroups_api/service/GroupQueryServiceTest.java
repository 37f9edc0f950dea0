package com.studygroups.studygroups_api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.studygroups.studygroups_api.dto.GroupMemberView;
import com.studygroups.studygroups_api.dto.GroupView;
import com.studygroups.studygroups_api.dto.MatchingStatusResponse;
import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.MatchingRun;
import com.studygroups.studygroups_api.model.Student;
import com.studygroups.studygroups_api.model.StudyGroup;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.MatchingRunRepository;
import com.studygroups.studygroups_api.repository.StudentRepository;
import com.studygroups.studygroups_api.repository.StudyGroupRepository;

@ExtendWith(MockitoExtension.class)
class GroupQueryServiceTest {

    @Mock
    private MatchingRunRepository matchingRunRepository;

    @Mock
    private StudyGroupRepository studyGroupRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private StudentRepository studentRepository;

    private GroupQueryService groupQueryService;

    @BeforeEach
    void setUp() {
        groupQueryService = new GroupQueryService(matchingRunRepository, studyGroupRepository, courseRepository, studentRepository);
    }

    private static MatchingRun completedRun(String id) {
        MatchingRun run = new MatchingRun(MatchingRun.Status.COMPLETED, Instant.parse("2026-03-01T09:00:00Z"));
        run.setId(id);
        run.setCompletedAt(Instant.parse("2026-03-01T09:00:01Z"));
        run.setGroupCount(3);
        return run;
    }

    private static StudyGroup group(String id, String courseId, int index, String... members) {
        StudyGroup group = new StudyGroup("run-1", courseId, index, List.of(members), Instant.now());
        group.setId(id);
        return group;
    }

    private static Course course(String id, String code) {
        Course course = new Course(code, code + " course");
        course.setId(id);
        return course;
    }

    private static Student student(String id, String name) {
        Student student = new Student(name, id + "@uni.edu", 3);
        student.setId(id);
        return student;
    }

    @Test
    @DisplayName("returns nothing before any run completed")
    void noCompletedRun() {
        when(matchingRunRepository.findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED))
                .thenReturn(Optional.empty());

        assertThat(groupQueryService.getLatestGroups()).isEmpty();
        verifyNoInteractions(studyGroupRepository);
    }

    @Test
    @DisplayName("orders groups by course code and index, members by name")
    void joinsAndOrders() {
        when(matchingRunRepository.findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED))
                .thenReturn(Optional.of(completedRun("run-1")));
        when(studyGroupRepository.findAllByRunId("run-1")).thenReturn(List.of(
                group("g3", "math", 1, "s4", "s5"),
                group("g2", "cs", 2, "s3", "s6"),
                group("g1", "cs", 1, "s2", "s1")));
        when(courseRepository.findAllById(anyIterable()))
                .thenReturn(List.of(course("math", "MATH201"), course("cs", "CS101")));
        when(studentRepository.findAllById(anyIterable())).thenReturn(List.of(
                student("s1", "Zoe"), student("s2", "Adam"), student("s3", "Mia"),
                student("s4", "Eve"), student("s5", "Dan")));

        List<GroupView> groups = groupQueryService.getLatestGroups();

        assertThat(groups).extracting(GroupView::groupId).containsExactly("g1", "g2", "g3");
        assertThat(groups.get(0).courseCode()).isEqualTo("CS101");
        assertThat(groups.get(0).members()).extracting(GroupMemberView::name).containsExactly("Adam", "Zoe");
        // s6 no longer exists and is dropped from the view
        assertThat(groups.get(1).members()).extracting(GroupMemberView::id).containsExactly("s3");
        assertThat(groups.get(2).members()).extracting(GroupMemberView::name).containsExactly("Dan", "Eve");
    }

    @Test
    @DisplayName("reads again when the resolved run is superseded before its groups load")
    void readsAgainWhenRunSuperseded() {
        when(matchingRunRepository.findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED))
                .thenReturn(Optional.of(completedRun("run-1")), Optional.of(completedRun("run-3")));
        when(studyGroupRepository.findAllByRunId("run-1")).thenReturn(List.of());
        when(studyGroupRepository.findAllByRunId("run-3")).thenReturn(List.of(group("g9", "cs", 1, "s1")));
        when(courseRepository.findAllById(anyIterable())).thenReturn(List.of(course("cs", "CS101")));
        when(studentRepository.findAllById(anyIterable())).thenReturn(List.of(student("s1", "Zoe")));

        List<GroupView> groups = groupQueryService.getLatestGroups();

        assertThat(groups).extracting(GroupView::groupId).containsExactly("g9");
    }

    @Test
    @DisplayName("an unchanged run without groups is reported as empty")
    void emptyRunIsNotRetried() {
        when(matchingRunRepository.findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED))
                .thenReturn(Optional.of(completedRun("run-1")));
        when(studyGroupRepository.findAllByRunId("run-1")).thenReturn(List.of());

        assertThat(groupQueryService.getLatestGroups()).isEmpty();
        verify(studyGroupRepository, times(1)).findAllByRunId("run-1");
    }

    @Test
    @DisplayName("status reports NOT_RUN when nothing has run")
    void statusNotRun() {
        when(matchingRunRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.empty());

        MatchingStatusResponse status = groupQueryService.getStatus(false);

        assertThat(status.status()).isEqualTo("NOT_RUN");
        assertThat(status.runId()).isNull();
    }

    @Test
    @DisplayName("status reports the latest run")
    void statusLatestRun() {
        when(matchingRunRepository.findFirstByOrderByStartedAtDesc()).thenReturn(Optional.of(completedRun("run-7")));

        MatchingStatusResponse status = groupQueryService.getStatus(true);

        assertThat(status.runId()).isEqualTo("run-7");
        assertThat(status.status()).isEqualTo("COMPLETED");
        assertThat(status.groupCount()).isEqualTo(3);
        assertThat(status.running()).isTrue();
    }
}
