package com.studygroups.studygroups_api.model;

import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document("courses")
public class Course {
    @Id
    private String id;
    @Indexed(unique = true)
    private String code;
    private String name;

    public Course() {}

    public Course(String code, String name) {
        this.code = code;
        this.name = name;
    }

    public String getId() { return id; }
    public String getCode() { return code; }
    public String getName() { return name; }

    public void setId(String id) { this.id = id; }
    public void setCode(String code) { this.code = code; }
    public void setName(String name) { this.name = name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Course course = (Course) o;
        if (id == null || course.id == null) {
            return false;
        }
        return Objects.equals(id, course.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
