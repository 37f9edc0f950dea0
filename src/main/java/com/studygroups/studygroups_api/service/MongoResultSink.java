package com.studygroups.studygroups_api.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.studygroups.studygroups_api.matching.ResultSink;
import com.studygroups.studygroups_api.model.MatchingRun;
import com.studygroups.studygroups_api.model.StudyGroup;
import com.studygroups.studygroups_api.repository.MatchingRunRepository;
import com.studygroups.studygroups_api.repository.StudyGroupRepository;

/**
 * Staged group storage. New groups are tagged with a STAGING run and become visible only
 * when that run is marked COMPLETED. Groups of the run it replaces are kept until the
 * following publish, so a reader that resolved the previous run can still load it. Callers are
 * expected to serialize runs (see {@link CourseMatchingOrchestrator}).
 */
@Component
public class MongoResultSink implements ResultSink {

    private static final Logger logger = LoggerFactory.getLogger(MongoResultSink.class);

    private final StudyGroupRepository studyGroupRepository;
    private final MatchingRunRepository matchingRunRepository;
    private final AtomicReference<MatchingRun> stagedRun = new AtomicReference<>();
    private final AtomicInteger stagedGroupCount = new AtomicInteger();

    public MongoResultSink(StudyGroupRepository studyGroupRepository, MatchingRunRepository matchingRunRepository) {
        this.studyGroupRepository = studyGroupRepository;
        this.matchingRunRepository = matchingRunRepository;
    }

    @Override
    public void clearAllGroups() {
        MatchingRun previous = stagedRun.get();
        if (previous != null) {
            logger.warn("Run {} was never published or discarded; abandoning it", previous.getId());
        }
        MatchingRun run = matchingRunRepository.save(new MatchingRun(MatchingRun.Status.STAGING, Instant.now()));
        stagedRun.set(run);
        stagedGroupCount.set(0);
        logger.info("Staging run {} opened; previous groups will be replaced on publish", run.getId());
    }

    @Override
    public String writeGroup(String courseId, int groupIndex, List<String> memberIds) {
        MatchingRun run = requireStagedRun();
        List<String> members = new ArrayList<>(new LinkedHashSet<>(memberIds));
        StudyGroup saved = studyGroupRepository.save(
                new StudyGroup(run.getId(), courseId, groupIndex, members, Instant.now()));
        stagedGroupCount.incrementAndGet();
        return saved.getId();
    }

    @Override
    public void publish() {
        MatchingRun run = requireStagedRun();
        Optional<MatchingRun> replaced = matchingRunRepository
                .findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status.COMPLETED);

        run.setStatus(MatchingRun.Status.COMPLETED);
        run.setCompletedAt(Instant.now());
        run.setGroupCount(stagedGroupCount.get());
        matchingRunRepository.save(run);
        stagedRun.set(null);

        // The run is committed at this point; the next publish retries a failed cleanup.
        // Groups of the replaced run survive one more cycle for readers that already resolved it.
        List<String> retainedRunIds = new ArrayList<>();
        retainedRunIds.add(run.getId());
        replaced.ifPresent(previous -> retainedRunIds.add(previous.getId()));
        try {
            long removed = studyGroupRepository.deleteByRunIdNotIn(retainedRunIds);
            logger.info("Run {} published with {} groups; kept runs {}, removed {} older groups",
                    run.getId(), run.getGroupCount(), retainedRunIds, removed);
        } catch (RuntimeException e) {
            logger.error("Run {} published but removing groups from earlier runs failed", run.getId(), e);
        }
    }

    @Override
    public void discard() {
        MatchingRun run = stagedRun.getAndSet(null);
        if (run == null) {
            return;
        }
        logger.warn("Discarding staged run {}", run.getId());
        long removed = studyGroupRepository.deleteByRunId(run.getId());
        run.setStatus(MatchingRun.Status.FAILED);
        run.setCompletedAt(Instant.now());
        run.setGroupCount(0);
        matchingRunRepository.save(run);
        logger.warn("Removed {} staged groups for failed run {}", removed, run.getId());
    }

    private MatchingRun requireStagedRun() {
        MatchingRun run = stagedRun.get();
        if (run == null) {
            throw new IllegalStateException("No staged matching run; call clearAllGroups() first.");
        }
        return run;
    }
}
