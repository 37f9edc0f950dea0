package com.studygroups.studygroups_api.model;

import java.time.DayOfWeek;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A weekly time window students can mark as available. Matching only compares ids.
 */
@Document("timeslots")
public class TimeSlot {
    @Id
    private String id;
    @Indexed(unique = true)
    private String label;
    private DayOfWeek dayOfWeek;
    private String startTime; // "HH:mm"
    private String endTime;

    public TimeSlot() {}

    public TimeSlot(String label, DayOfWeek dayOfWeek, String startTime, String endTime) {
        this.label = label;
        this.dayOfWeek = dayOfWeek;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getId() { return id; }
    public String getLabel() { return label; }
    public DayOfWeek getDayOfWeek() { return dayOfWeek; }
    public String getStartTime() { return startTime; }
    public String getEndTime() { return endTime; }

    public void setId(String id) { this.id = id; }
    public void setLabel(String label) { this.label = label; }
    public void setDayOfWeek(DayOfWeek dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public void setStartTime(String startTime) { this.startTime = startTime; }
    public void setEndTime(String endTime) { this.endTime = endTime; }

    @Override
    public String toString() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeSlot timeSlot = (TimeSlot) o;
        if (id == null || timeSlot.id == null) {
            return false;
        }
        return Objects.equals(id, timeSlot.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
