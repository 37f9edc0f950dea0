package com.studygroups.studygroups_api.dto;

import java.util.List;

/**
 * Payload for creating or updating a student, keyed by email.
 */
public record StudentRequest(String name, String email, Integer preferredGroupSize,
                             List<String> courseIds, List<String> availabilityTimeslotIds) {
}
