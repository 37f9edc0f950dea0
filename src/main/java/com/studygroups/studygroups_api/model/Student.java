package com.studygroups.studygroups_api.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("students")
public class Student {
    @Id
    private String id;
    private String name;
    @Indexed(unique = true)
    private String email;
    private int preferredGroupSize;
    private List<String> courseIds;
    private List<String> availabilityTimeslotIds;
    private Instant createdAt;

    // Constructors
    public Student() {}

    public Student(String name, String email, int preferredGroupSize) {
        this.name = name;
        this.email = email;
        this.preferredGroupSize = preferredGroupSize;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public String getEmail() { return email; }
    public int getPreferredGroupSize() { return preferredGroupSize; }
    public List<String> getCourseIds() { return courseIds; }
    public List<String> getAvailabilityTimeslotIds() { return availabilityTimeslotIds; }
    public Instant getCreatedAt() { return createdAt; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setEmail(String email) { this.email = email; }
    public void setPreferredGroupSize(int preferredGroupSize) { this.preferredGroupSize = preferredGroupSize; }
    public void setCourseIds(List<String> courseIds) { this.courseIds = courseIds; }
    public void setAvailabilityTimeslotIds(List<String> availabilityTimeslotIds) { this.availabilityTimeslotIds = availabilityTimeslotIds; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    // Identity is the document id; unsaved students are never equal
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Student student = (Student) o;
        if (id == null || student.id == null) {
            return false;
        }
        return Objects.equals(id, student.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
