package com.herzen.prereq.api;

import com.herzen.prereq.repository.CourseJdbcRepository.CourseRow;
import com.herzen.prereq.requirement.Requirement;
import com.herzen.prereq.service.CourseCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private final CourseCatalogService catalogService;

    public CourseController(CourseCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PutMapping("/{code}")
    public ResponseEntity<CourseRow> register(@PathVariable String code, @RequestBody CourseRequest request) {
        return ResponseEntity.ok(catalogService.register(code, request.title(), request.requirement()));
    }

    @GetMapping("/{code}")
    public ResponseEntity<CourseRow> find(@PathVariable String code) {
        return ResponseEntity.ok(catalogService.find(code));
    }

    @GetMapping
    public ResponseEntity<List<CourseRow>> list() {
        return ResponseEntity.ok(catalogService.findAll());
    }

    public record CourseRequest(String title, Requirement requirement) {}
}
