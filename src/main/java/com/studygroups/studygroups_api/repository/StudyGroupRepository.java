package com.studygroups.studygroups_api.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import com.studygroups.studygroups_api.model.StudyGroup;

public interface StudyGroupRepository extends MongoRepository<StudyGroup, String> {

    List<StudyGroup> findAllByRunId(String runId);

    // Returns the count of deleted documents
    long deleteByRunId(String runId);

    // Removes groups of every run not listed
    long deleteByRunIdNotIn(Collection<String> runIds);
}
