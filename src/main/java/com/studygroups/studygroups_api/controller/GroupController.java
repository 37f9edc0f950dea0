package com.studygroups.studygroups_api.controller;

import java.io.ByteArrayInputStream;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.studygroups.studygroups_api.dto.GroupsResponse;
import com.studygroups.studygroups_api.service.GroupExportService;
import com.studygroups.studygroups_api.service.GroupQueryService;

@RestController
@RequestMapping("/api/groups")
public class GroupController {

    private static final Logger logger = LoggerFactory.getLogger(GroupController.class);

    private final GroupQueryService groupQueryService;
    private final GroupExportService groupExportService;

    public GroupController(GroupQueryService groupQueryService, GroupExportService groupExportService) {
        this.groupQueryService = groupQueryService;
        this.groupExportService = groupExportService;
    }

    // Latest stored groups, without rerunning the algorithm
    @GetMapping
    public GroupsResponse getGroups() {
        return new GroupsResponse(groupQueryService.getLatestGroups());
    }

    @GetMapping("/export")
    public ResponseEntity<InputStreamResource> exportGroups() throws IOException {
        logger.info(">>> Received request to export study groups");
        ByteArrayInputStream bis = groupExportService.generateGroupsExcel();
        String filename = groupExportService.getExcelFilename();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + filename + "\"")
                .contentType(MediaType.parseMediaType("application/vnd.ms-excel"))
                .body(new InputStreamResource(bis));
    }
}
