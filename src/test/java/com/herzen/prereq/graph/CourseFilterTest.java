package com.herzen.prereq.graph;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CourseFilterTest {
    private final CourseFilter filter = new CourseFilter();
    private final GraphOptions noFilters = new GraphOptions(Set.of(), Set.of(), false, false, Set.of(), 100);

    @Test
    void includesEverythingWithoutFilters() {
        assertTrue(filter.shouldInclude(noFilters, "CSC148H1"));
        assertTrue(filter.shouldInclude(noFilters, "MATA31H3"));
        assertTrue(filter.shouldInclude(noFilters, ""));
    }

    @Test
    void keepsCoursesPrefixedByConfiguredDepartment() {
        GraphOptions options = noFilters.withDepartments(Set.of("CSC", "STA"));

        assertTrue(filter.shouldInclude(options, "CSC148H1"));
        assertTrue(filter.shouldInclude(options, "STA247H1"));
        assertFalse(filter.shouldInclude(options, "MAT137Y1"));
    }

    @Test
    void keepsCoursesWhoseSuffixMatchesLocation() {
        GraphOptions main = noFilters.withLocations(Set.of("main"));
        assertTrue(filter.shouldInclude(main, "CSC148H1"));
        assertFalse(filter.shouldInclude(main, "CSCA08H3"));
        assertFalse(filter.shouldInclude(main, "CSC108H5"));

        GraphOptions satellites = noFilters.withLocations(Set.of("satellite-a", "satellite-b"));
        assertTrue(filter.shouldInclude(satellites, "CSCA08H3"));
        assertTrue(filter.shouldInclude(satellites, "CSC108H5"));
        assertFalse(filter.shouldInclude(satellites, "CSC148H1"));
    }

    @Test
    void unknownLocationMatchesNothing() {
        GraphOptions options = noFilters.withLocations(Set.of("downtown"));

        assertFalse(filter.shouldInclude(options, "CSC148H1"));
        assertFalse(filter.shouldInclude(options, "CSCA08H3"));
        assertFalse(filter.shouldInclude(options, "CSC108H5"));
        assertFalse(filter.shouldInclude(options, "somethinge"));
        assertFalse(filter.shouldInclude(options, ""));
    }

    @Test
    void unknownLocationDoesNotHideKnownOnes() {
        GraphOptions options = noFilters.withLocations(Set.of("downtown", "satellite-a"));

        assertTrue(filter.shouldInclude(options, "CSCA08H3"));
        assertFalse(filter.shouldInclude(options, "CSC148H1"));
    }

    @Test
    void requiresBothDepartmentAndLocation() {
        GraphOptions options = noFilters.withDepartments(Set.of("CSC")).withLocations(Set.of("main"));

        assertTrue(filter.shouldInclude(options, "CSC148H1"));
        assertFalse(filter.shouldInclude(options, "CSCA08H3"));
        assertFalse(filter.shouldInclude(options, "MAT137Y1"));
    }
}
