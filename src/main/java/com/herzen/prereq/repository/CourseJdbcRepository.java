package com.herzen.prereq.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.prereq.requirement.Requirement;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class CourseJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void save(CourseRow course) {
        jdbcTemplate.update("DELETE FROM courses WHERE code = ?", course.code());
        jdbcTemplate.update("INSERT INTO courses(code, title, requirement) VALUES (?,?,?)",
                course.code(), course.title(), writeRequirement(course.requirement()));
    }

    public Optional<CourseRow> findByCode(String code) {
        return jdbcTemplate.query("SELECT code, title, requirement FROM courses WHERE code = ?", rowMapper(), code)
                .stream()
                .findFirst();
    }

    public List<CourseRow> findAll() {
        return jdbcTemplate.query("SELECT code, title, requirement FROM courses ORDER BY code", rowMapper());
    }

    private RowMapper<CourseRow> rowMapper() {
        return (rs, rowNum) -> new CourseRow(rs.getString(1), rs.getString(2), readRequirement(rs.getString(3)));
    }

    private String writeRequirement(Requirement requirement) {
        try {
            return objectMapper.writeValueAsString(requirement == null ? Requirement.none() : requirement);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize requirement", e);
        }
    }

    private Requirement readRequirement(String json) {
        try {
            return objectMapper.readValue(json, Requirement.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored requirement is not valid JSON: " + json, e);
        }
    }

    public record CourseRow(String code, String title, Requirement requirement) {}
}
