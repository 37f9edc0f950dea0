package com.studygroups.studygroups_api.dto;

import java.util.List;

/**
 * A stored group joined with its course and member details.
 */
public record GroupView(String groupId, String courseId, String courseCode, String courseName,
                        int groupIndex, List<GroupMemberView> members) {
}
