package com.studygroups.studygroups_api.config;

import java.time.DayOfWeek;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.studygroups.studygroups_api.model.Course;
import com.studygroups.studygroups_api.model.TimeSlot;
import com.studygroups.studygroups_api.repository.CourseRepository;
import com.studygroups.studygroups_api.repository.TimeSlotRepository;

/**
 * Inserts the default courses and weekly time slots on startup. Existing entries,
 * matched by course code or slot label, are left untouched.
 */
@Component
@ConditionalOnProperty(name = "seed.reference-data.enabled", havingValue = "true", matchIfMissing = true)
public class ReferenceDataSeeder implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataSeeder.class);

    static final List<Course> DEFAULT_COURSES = List.of(
            new Course("CS101", "Intro to Computer Science"),
            new Course("MATH201", "Discrete Mathematics"),
            new Course("PHYS150", "General Physics"));

    static final List<TimeSlot> DEFAULT_TIMESLOTS = List.of(
            new TimeSlot("Mon 10-12", DayOfWeek.MONDAY, "10:00", "12:00"),
            new TimeSlot("Mon 14-16", DayOfWeek.MONDAY, "14:00", "16:00"),
            new TimeSlot("Tue 10-12", DayOfWeek.TUESDAY, "10:00", "12:00"),
            new TimeSlot("Tue 14-16", DayOfWeek.TUESDAY, "14:00", "16:00"),
            new TimeSlot("Wed 10-12", DayOfWeek.WEDNESDAY, "10:00", "12:00"),
            new TimeSlot("Wed 14-16", DayOfWeek.WEDNESDAY, "14:00", "16:00"));

    private final CourseRepository courseRepository;
    private final TimeSlotRepository timeSlotRepository;

    public ReferenceDataSeeder(CourseRepository courseRepository, TimeSlotRepository timeSlotRepository) {
        this.courseRepository = courseRepository;
        this.timeSlotRepository = timeSlotRepository;
    }

    @Override
    public void run(String... args) {
        int courses = 0;
        for (Course course : DEFAULT_COURSES) {
            if (courseRepository.findByCode(course.getCode()).isEmpty()) {
                courseRepository.save(new Course(course.getCode(), course.getName()));
                courses++;
            }
        }

        int slots = 0;
        for (TimeSlot slot : DEFAULT_TIMESLOTS) {
            if (timeSlotRepository.findByLabel(slot.getLabel()).isEmpty()) {
                timeSlotRepository.save(new TimeSlot(slot.getLabel(), slot.getDayOfWeek(), slot.getStartTime(), slot.getEndTime()));
                slots++;
            }
        }
        logger.info("Reference data seeded: {} new courses, {} new time slots", courses, slots);
    }
}
