package com.herzen.prereq.graph;

import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class CourseFilter {

    public boolean shouldInclude(GraphOptions options, String courseName) {
        return matchesDepartment(options, courseName) && matchesLocation(options, courseName);
    }

    boolean matchesDepartment(GraphOptions options, String courseName) {
        return options.departments().isEmpty()
                || options.departments().stream().anyMatch(courseName::startsWith);
    }

    boolean matchesLocation(GraphOptions options, String courseName) {
        if (options.locations().isEmpty()) return true;
        if (courseName.isEmpty()) return false;

        char courseSuffix = courseName.charAt(courseName.length() - 1);
        return options.locations().stream()
                .map(CampusLocation::fromCode)
                .flatMap(Optional::stream)
                .anyMatch(l -> l.suffix() == courseSuffix);
    }
}
