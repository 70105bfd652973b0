package com.coursereq.domain;

public class CourseNotFoundException extends RuntimeException {
    private final String courseId;

    public CourseNotFoundException(String courseId) {
        super("No stored requirements for course " + courseId);
        this.courseId = courseId;
    }

    public String courseId() {
        return courseId;
    }
}
