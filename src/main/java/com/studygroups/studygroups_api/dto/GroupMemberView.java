package com.studygroups.studygroups_api.dto;

public record GroupMemberView(String id, String name, String email) {
}
