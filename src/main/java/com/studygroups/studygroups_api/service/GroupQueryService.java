package com.studygroups.studygroups_api.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

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

import lombok.RequiredArgsConstructor;

/**
 * Read side for stored groups. Only the groups of the latest completed run are returned,
 * ordered by course code and group index, members by name.
 */
@Service
@RequiredArgsConstructor
public class GroupQueryService {

    private static final Logger logger = LoggerFactory.getLogger(GroupQueryService.class);

    private static final Comparator<GroupView> GROUP_ORDER = Comparator
            .comparing(GroupView::courseCode, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparingInt(GroupView::groupIndex);

    private static final Comparator<GroupMemberView> MEMBER_ORDER = Comparator
            .comparing(GroupMemberView::name, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(GroupMemberView::id);

    static final int MAX_READ_ATTEMPTS = 3;

    private final MatchingRunRepository matchingRunRepository;
    private final StudyGroupRepository studyGroupRepository;
    private final CourseRepository courseRepository;
    private final StudentRepository studentRepository;

    public List<GroupView> getLatestGroups() {
        for (int attempt = 1; ; attempt++) {
            Optional<MatchingRun> latest = findLatestCompletedRun();
            if (latest.isEmpty()) {
                return new ArrayList<>();
            }

            String runId = latest.get().getId();
            List<StudyGroup> groups = studyGroupRepository.findAllByRunId(runId);
            if (!groups.isEmpty()) {
                return toViews(groups);
            }
            // Two publishes between resolving the run and loading its groups remove them; read again.
            if (attempt >= MAX_READ_ATTEMPTS || !isSuperseded(runId)) {
                return new ArrayList<>();
            }
            logger.debug("Run {} was superseded while loading its groups; reading again", runId);
        }
    }

    private Optional<MatchingRun> findLatestCompletedRun() {
        return matchingRunRepository.findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED);
    }

    private boolean isSuperseded(String runId) {
        return findLatestCompletedRun()
                .map(run -> !run.getId().equals(runId))
                .orElse(false);
    }

    private List<GroupView> toViews(List<StudyGroup> groups) {
        Set<String> courseIds = groups.stream().map(StudyGroup::getCourseId).collect(Collectors.toSet());
        Set<String> studentIds = groups.stream()
                .filter(g -> g.getMemberIds() != null)
                .flatMap(g -> g.getMemberIds().stream())
                .collect(Collectors.toSet());

        Map<String, Course> courseMap = courseRepository.findAllById(courseIds).stream()
                .collect(Collectors.toMap(Course::getId, Function.identity(), (c1, c2) -> c1));
        Map<String, Student> studentMap = studentRepository.findAllById(studentIds).stream()
                .collect(Collectors.toMap(Student::getId, Function.identity(), (s1, s2) -> s1));

        List<GroupView> views = new ArrayList<>(groups.size());
        for (StudyGroup group : groups) {
            Course course = courseMap.get(group.getCourseId());
            if (course == null) {
                logger.warn("Group {} references missing course {}; skipping", group.getId(), group.getCourseId());
                continue;
            }
            List<GroupMemberView> members = new ArrayList<>();
            if (group.getMemberIds() != null) {
                for (String memberId : group.getMemberIds()) {
                    Student student = studentMap.get(memberId);
                    if (student != null) {
                        members.add(new GroupMemberView(student.getId(), student.getName(), student.getEmail()));
                    }
                }
            }
            members.sort(MEMBER_ORDER);
            views.add(new GroupView(group.getId(), course.getId(), course.getCode(), course.getName(),
                    group.getGroupIndex(), members));
        }
        views.sort(GROUP_ORDER);
        return views;
    }

    public MatchingStatusResponse getStatus(boolean running) {
        return matchingRunRepository.findFirstByOrderByStartedAtDesc()
                .map(run -> new MatchingStatusResponse(run.getId(), run.getStatus().name(), run.getStartedAt(),
                        run.getCompletedAt(), run.getGroupCount(), running))
                .orElseGet(() -> new MatchingStatusResponse(null, "NOT_RUN", null, null, 0, running));
    }
}
