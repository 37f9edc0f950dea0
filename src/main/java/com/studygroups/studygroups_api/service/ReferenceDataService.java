package com.studygroups.studygroups_api.service;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.TimeSlot;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.TimeSlotRepository;

@Service
public class ReferenceDataService {

    private static final Comparator<TimeSlot> WEEK_ORDER = Comparator
            .comparing(TimeSlot::getDayOfWeek, Comparator.nullsLast(Comparator.<DayOfWeek>naturalOrder()))
            .thenComparing(TimeSlot::getStartTime, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final CourseRepository courseRepository;
    private final TimeSlotRepository timeSlotRepository;

    public ReferenceDataService(CourseRepository courseRepository, TimeSlotRepository timeSlotRepository) {
        this.courseRepository = courseRepository;
        this.timeSlotRepository = timeSlotRepository;
    }

    public List<Course> getAllCourses() {
        return courseRepository.findAll(Sort.by(Sort.Direction.ASC, "code"));
    }

    // Sorted in memory: dayOfWeek is stored as a name, which would sort alphabetically in Mongo.
    public List<TimeSlot> getAllTimeSlots() {
        List<TimeSlot> slots = new ArrayList<>(timeSlotRepository.findAll());
        slots.sort(WEEK_ORDER);
        return slots;
    }
}
