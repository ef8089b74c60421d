package com.herzen.prereq.lookup;

import com.herzen.prereq.exception.CourseNotFoundException;
import com.herzen.prereq.graph.GraphOptions;
import com.herzen.prereq.repository.CourseJdbcRepository;
import com.herzen.prereq.repository.CourseJdbcRepository.CourseRow;
import com.herzen.prereq.requirement.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class CourseFinder {
    private static final Logger log = LoggerFactory.getLogger(CourseFinder.class);

    private final CourseJdbcRepository repository;

    public CourseFinder(CourseJdbcRepository repository) {
        this.repository = repository;
    }

    public SortedMap<String, Requirement> lookupCourses(GraphOptions options, Collection<String> rootCourses) {
        SortedMap<String, Requirement> found = new TreeMap<>();
        Set<String> missing = new HashSet<>();
        Deque<Pending> queue = new ArrayDeque<>();

        for (String root : rootCourses) {
            CourseRow row = repository.findByCode(root).orElseThrow(() -> new CourseNotFoundException(root));
            if (found.put(row.code(), row.requirement()) == null) {
                queue.add(new Pending(row.code(), row.requirement(), 0));
            }
        }

        while (!queue.isEmpty()) {
            Pending current = queue.poll();
            if (current.depth() >= options.maxDepth()) continue;

            for (String prereq : current.requirement().referencedCourses()) {
                if (found.containsKey(prereq) || missing.contains(prereq) || options.taken().contains(prereq)) continue;

                Optional<CourseRow> row = repository.findByCode(prereq);
                if (row.isEmpty()) {
                    missing.add(prereq);
                    log.debug("Prerequisite {} of {} is not in the catalog", prereq, current.courseName());
                    continue;
                }
                found.put(prereq, row.get().requirement());
                queue.add(new Pending(prereq, row.get().requirement(), current.depth() + 1));
            }
        }

        log.debug("Resolved {} root course(s) into {} course(s)", rootCourses.size(), found.size());
        return found;
    }

    private record Pending(String courseName, Requirement requirement, int depth) {}
}
