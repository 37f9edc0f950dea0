package com.studygroups.studygroups_api.repository;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.studygroups.studygroups_api.model.TimeSlot;

@Repository
public interface TimeSlotRepository extends MongoRepository<TimeSlot, String> {
    Optional<TimeSlot> findByLabel(String label);
}
