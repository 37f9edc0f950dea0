package com.studygroups.studygroups_api.dto;

import java.time.Instant;

/**
 * State of the latest matching run. {@code status} is NOT_RUN when nothing has run yet.
 */
public record MatchingStatusResponse(String runId, String status, Instant startedAt, Instant completedAt,
                                     int groupCount, boolean running) {
}
