package com.studygroups.studygroups_api.matching;

import java.util.List;

/**
 * Receives the groups produced by a matching run.
 *
 * <p>A run calls {@link #clearAllGroups()} once, then {@link #writeGroup} per group,
 * then {@link #publish()}. If anything fails after the clear, {@link #discard()} is
 * called instead of {@code publish()}. Implementations must keep readers from
 * observing a cleared-but-unwritten state.
 */
public interface ResultSink {

    /** Replace every previously stored group, for every course. Fails loudly on storage errors. */
    void clearAllGroups();

    /** Persist one group and its memberships; returns the new group id. */
    String writeGroup(String courseId, int groupIndex, List<String> memberIds);

    /** Make the groups written since the last clear visible to readers. */
    void publish();

    /** Drop the groups written since the last clear, leaving the previous result in place. */
    void discard();
}
