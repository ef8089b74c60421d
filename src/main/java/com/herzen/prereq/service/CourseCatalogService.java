package com.herzen.prereq.service;

import com.herzen.prereq.exception.CourseNotFoundException;
import com.herzen.prereq.exception.InvalidRequestException;
import com.herzen.prereq.repository.CourseJdbcRepository;
import com.herzen.prereq.repository.CourseJdbcRepository.CourseRow;
import com.herzen.prereq.requirement.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CourseCatalogService {
    private static final Logger log = LoggerFactory.getLogger(CourseCatalogService.class);

    private final CourseJdbcRepository repository;

    public CourseCatalogService(CourseJdbcRepository repository) {
        this.repository = repository;
    }

    public CourseRow register(String code, String title, Requirement requirement) {
        if (code == null || code.isBlank()) {
            throw new InvalidRequestException("Course code is required");
        }
        CourseRow row = new CourseRow(code.trim(), title, requirement == null ? Requirement.none() : requirement);
        int referenced = row.requirement().referencedCourses().size();
        repository.save(row);
        log.info("Registered course {} with {} referenced prerequisite(s)", row.code(), referenced);
        return row;
    }

    public CourseRow find(String code) {
        return repository.findByCode(code).orElseThrow(() -> new CourseNotFoundException(code));
    }

    public List<CourseRow> findAll() {
        return repository.findAll();
    }
}
