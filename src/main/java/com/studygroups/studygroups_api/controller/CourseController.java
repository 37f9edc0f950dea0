package com.studygroups.studygroups_api.controller;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.TimeSlot;
import com.studygroups.studygroups_api.service.ReferenceDataService;

/**
 * Read-only reference data: courses and weekly time slots.
 */
@RestController
public class CourseController {

    private final ReferenceDataService referenceDataService;

    public CourseController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @GetMapping("/api/courses")
    public List<Course> getAllCourses() {
        return referenceDataService.getAllCourses();
    }

    @GetMapping("/api/timeslots")
    public List<TimeSlot> getAllTimeSlots() {
        return referenceDataService.getAllTimeSlots();
    }
}
