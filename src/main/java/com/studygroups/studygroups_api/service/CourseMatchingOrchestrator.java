package com.studygroups.studygroups_api.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.studygroups.studygroups_api.exception.MatchingFailedException;
import com.studygroups.studygroups_api.exception.MatchingInProgressException;
import com.studygroups.studygroups_api.matching.GroupFormationEngine;
import com.studygroups.studygroups_api.matching.ResultSink;
import com.studygroups.studygroups_api.matching.RosterProvider;
import com.studygroups.studygroups_api.matching.StudentProfile;

/**
 * Runs group formation for every course and hands the result to the {@link ResultSink}.
 * Only one run may be in flight at a time.
 */
@Service
public class CourseMatchingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CourseMatchingOrchestrator.class);

    private final RosterProvider rosterProvider;
    private final ResultSink resultSink;
    private final GroupFormationEngine groupFormationEngine;
    private final long lockWaitMillis;
    private final ReentrantLock runLock = new ReentrantLock();

    public CourseMatchingOrchestrator(RosterProvider rosterProvider, ResultSink resultSink,
                                      GroupFormationEngine groupFormationEngine,
                                      @Value("${matching.lock-wait-ms:5000}") long lockWaitMillis) {
        this.rosterProvider = rosterProvider;
        this.resultSink = resultSink;
        this.groupFormationEngine = groupFormationEngine;
        this.lockWaitMillis = lockWaitMillis;
    }

    public Map<String, List<List<String>>> runMatching() {
        acquireRunLock();
        try {
            return runLocked();
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    private void acquireRunLock() {
        boolean acquired;
        try {
            acquired = runLock.tryLock(lockWaitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchingInProgressException("Interrupted while waiting for the running match to finish.");
        }
        if (!acquired) {
            logger.warn("Matching request rejected: another run is still in progress after {} ms", lockWaitMillis);
            throw new MatchingInProgressException("A matching run is already in progress. Try again later.");
        }
    }

    private Map<String, List<List<String>>> runLocked() {
        logger.info("Starting matching run");

        Map<String, List<StudentProfile>> rosters;
        try {
            rosters = rosterProvider.loadRosters();
        } catch (RuntimeException e) {
            logger.error("Failed to load course rosters", e);
            throw new MatchingFailedException("Could not load course rosters.", e);
        }

        // Form every group up front so a formation problem never follows a clear.
        Map<String, List<List<String>>> result = new LinkedHashMap<>();
        for (Map.Entry<String, List<StudentProfile>> entry : rosters.entrySet()) {
            List<StudentProfile> roster = entry.getValue();
            if (roster == null || roster.isEmpty()) {
                continue;
            }
            List<List<String>> groupIds = new ArrayList<>();
            for (List<StudentProfile> group : groupFormationEngine.formGroups(roster)) {
                List<String> memberIds = new ArrayList<>(group.size());
                for (StudentProfile student : group) {
                    memberIds.add(student.id());
                }
                groupIds.add(memberIds);
            }
            result.put(entry.getKey(), groupIds);
            logger.info("Course {}: {} students -> {} groups", entry.getKey(), roster.size(), groupIds.size());
        }

        if (result.isEmpty()) {
            logger.info("No enrolled students found; existing groups left untouched");
            return result;
        }

        persist(result);
        logger.info("Matching run finished for {} courses", result.size());
        return result;
    }

    private void persist(Map<String, List<List<String>>> result) {
        try {
            resultSink.clearAllGroups();
        } catch (RuntimeException e) {
            logger.error("Could not clear previous groups", e);
            throw new MatchingFailedException("Could not clear previous groups.", e);
        }

        try {
            int written = 0;
            for (Map.Entry<String, List<List<String>>> entry : result.entrySet()) {
                int groupIndex = 1;
                for (List<String> memberIds : entry.getValue()) {
                    resultSink.writeGroup(entry.getKey(), groupIndex++, memberIds);
                    written++;
                }
            }
            resultSink.publish();
            logger.info("Published {} groups", written);
        } catch (RuntimeException e) {
            logger.error("Matching run aborted while writing groups; discarding staged results", e);
            MatchingFailedException failure = new MatchingFailedException("Could not store the new groups.", e);
            try {
                resultSink.discard();
            } catch (RuntimeException cleanupError) {
                logger.error("Cleanup of staged groups failed", cleanupError);
                failure.addSuppressed(cleanupError);
            }
            throw failure;
        }
    }
}
