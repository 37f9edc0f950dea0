package com.studygroups.studygroups_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.studygroups.studygroups_api.model.MatchingRun;

public interface MatchingRunRepository extends MongoRepository<MatchingRun, String> {

    Optional<MatchingRun> findFirstByStatusOrderByCompletedAtDesc(MatchingRun.Status status);

    Optional<MatchingRun> findFirstByOrderByStartedAtDesc();
}
