package com.studygroups.studygroups_api.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.studygroups.studygroups_api.dto.GroupsResponse;
import com.studygroups.studygroups_api.dto.MatchingStatusResponse;
import com.studygroups.studygroups_api.service.CourseMatchingOrchestrator;
import com.studygroups.studygroups_api.service.GroupQueryService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/match")
@RequiredArgsConstructor
public class MatchController {

    private static final Logger logger = LoggerFactory.getLogger(MatchController.class);

    private final CourseMatchingOrchestrator orchestrator;
    private final GroupQueryService groupQueryService;

    /**
     * Runs matching for every course and returns the freshly stored groups.
     * Failures propagate to {@code GlobalExceptionHandler}.
     */
    @PostMapping
    public ResponseEntity<GroupsResponse> runMatch() {
        logger.info(">>> Received /match request.");
        Map<String, List<List<String>>> result = orchestrator.runMatching();
        if (result.isEmpty()) {
            return ResponseEntity.ok(GroupsResponse.empty());
        }
        return ResponseEntity.ok(new GroupsResponse(groupQueryService.getLatestGroups()));
    }

    @GetMapping("/status")
    public ResponseEntity<MatchingStatusResponse> getStatus() {
        return ResponseEntity.ok(groupQueryService.getStatus(orchestrator.isRunning()));
    }
}
