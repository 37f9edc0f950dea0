package com.studygroups.studygroups_api.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One staged replacement of the stored groups. Readers only see the groups of the most
 * recently completed run, so flipping {@link #status} to COMPLETED is the commit point.
 */
@Document("matching_runs")
@Data
@NoArgsConstructor
public class MatchingRun {

    public enum Status { STAGING, COMPLETED, FAILED }

    @Id
    private String id;
    private Status status;
    private Instant startedAt;
    private Instant completedAt;
    private int groupCount;

    public MatchingRun(Status status, Instant startedAt) {
        this.status = status;
        this.startedAt = startedAt;
    }
}
