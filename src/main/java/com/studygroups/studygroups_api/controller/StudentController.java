package com.studygroups.studygroups_api.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.studygroups.studygroups_api.dto.StudentRequest;
import com.studygroups.studygroups_api.model.Student;
import com.studygroups.studygroups_api.service.StudentService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/students")
@RequiredArgsConstructor
public class StudentController {

    private static final Logger logger = LoggerFactory.getLogger(StudentController.class);

    private final StudentService studentService;

    @GetMapping
    public List<Student> getAllStudents() {
        return studentService.getAllStudents();
    }

    @PostMapping
    public ResponseEntity<Student> upsertStudent(@RequestBody StudentRequest request) {
        logger.info(">>> Received student upsert for email: {}", request.email());
        return ResponseEntity.status(HttpStatus.CREATED).body(studentService.upsertStudent(request));
    }
}
