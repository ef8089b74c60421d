package com.herzen.prereq.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CourseNotFoundException extends RuntimeException {
    private final String courseCode;

    public CourseNotFoundException(String courseCode) {
        super("Course not found: " + courseCode);
        this.courseCode = courseCode;
    }

    public String getCourseCode() {
        return courseCode;
    }
}
