package com.studygroups.studygroups_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudygroupsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudygroupsApiApplication.class, args);
    }
}
