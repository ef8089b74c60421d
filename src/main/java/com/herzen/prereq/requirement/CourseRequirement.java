package com.herzen.prereq.requirement;

import java.util.List;
import java.util.Map;

public record CourseRequirement(String courseName, Requirement requirement) {

    public static List<CourseRequirement> fromMap(Map<String, Requirement> byCourse) {
        return byCourse.entrySet().stream()
                .map(e -> new CourseRequirement(e.getKey(), e.getValue()))
                .toList();
    }
}
