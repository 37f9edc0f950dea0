package com.studygroups.studygroups_api.matching;

import java.util.List;
import java.util.Map;

/**
 * Supplies the students enrolled in each course.
 *
 * <p>The returned map and every roster list must iterate in a stable order; the
 * grouping result depends on it.
 */
public interface RosterProvider {

    Map<String, List<StudentProfile>> loadRosters();
}
