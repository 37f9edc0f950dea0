package com.studygroups.studygroups_api.matching;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable view of a student as seen by the group formation engine.
 * Availability ids are opaque tokens; only their overlap matters.
 */
public record StudentProfile(String id, int preferredGroupSize, Set<String> availabilitySlotIds) {

    public StudentProfile {
        Objects.requireNonNull(id, "id");
        availabilitySlotIds = availabilitySlotIds == null ? Set.of() : Set.copyOf(availabilitySlotIds);
    }
}
