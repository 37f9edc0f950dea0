package com.studygroups.studygroups_api.dto;

import java.util.List;

public record GroupsResponse(List<GroupView> groups) {

    public static GroupsResponse empty() {
        return new GroupsResponse(List.of());
    }
}
