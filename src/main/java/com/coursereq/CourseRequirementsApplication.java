package com.coursereq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseRequirementsApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourseRequirementsApplication.class, args);
    }
}
