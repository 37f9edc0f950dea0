package com.studygroups.studygroups_api.model;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("study_groups")
public class StudyGroup {
    @Id
    private String id;
    @Indexed
    private String runId;
    private String courseId;
    private int groupIndex; // 1-based within the course
    private List<String> memberIds;
    private Instant createdAt;

    // No-arg constructor
    public StudyGroup() {}

    public StudyGroup(String runId, String courseId, int groupIndex, List<String> memberIds, Instant createdAt) {
        this.runId = runId;
        this.courseId = courseId;
        this.groupIndex = groupIndex;
        this.memberIds = memberIds;
        this.createdAt = createdAt;
    }

    // Getters
    public String getId() { return id; }
    public String getRunId() { return runId; }
    public String getCourseId() { return courseId; }
    public int getGroupIndex() { return groupIndex; }
    public List<String> getMemberIds() { return memberIds; }
    public Instant getCreatedAt() { return createdAt; }

    public void setId(String id) { this.id = id; }
}
