package com.herzen.prereq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.prereq.exception.CourseNotFoundException;
import com.herzen.prereq.exception.InvalidRequestException;
import com.herzen.prereq.graph.GraphModels;
import com.herzen.prereq.graph.GraphStyle;
import com.herzen.prereq.requirement.Requirement;
import com.herzen.prereq.service.CourseCatalogService;
import com.herzen.prereq.service.PrerequisiteGraphService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Set;

import static com.herzen.prereq.requirement.Requirement.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PrerequisiteGraphServiceTest {
    @Autowired
    private CourseCatalogService catalogService;

    @Autowired
    private PrerequisiteGraphService graphService;

    @Autowired
    private ObjectMapper objectMapper;

    private static List<String> labels(GraphModels.DotGraph graph) {
        return graph.nodes().stream().map(n -> n.attribute("label").orElseThrow()).toList();
    }

    @Test
    void buildsGraphFromStoredCourses() {
        catalogService.register("STA130H1", "Intro to Statistics", none());
        catalogService.register("STA247H1", "Probability", all(course("STA130H1"), course("MAT137Y1")));
        catalogService.register("STA302H1", "Regression", new Grade("B-", course("STA247H1")));

        var graph = graphService.prerequisiteGraph(List.of("STA302H1"), graphService.defaultOptions());

        assertEquals(List.of("STA130H1", "STA247H1", "and", "MAT137Y1", "STA302H1"), labels(graph));
        assertEquals(4, graph.edges().size());
        assertFalse(labels(graph).contains("B-"));
    }

    @Test
    void appliesRequestOptions() {
        catalogService.register("ECO101H1", "Microeconomics", new FreeText("Grade 12 calculus"));
        catalogService.register("ECO200H1", "Intermediate Micro",
                new CreditCount("1.0", all(course("ECO101H1"), course("MAT133Y1"))));

        var withText = graphService.prerequisiteGraph(List.of("ECO200H1"),
                graphService.defaultOptions().withFreeText(true).withDepartments(Set.of("ECO")));

        assertEquals(List.of("ECO101H1", "Grade 12 calculus", "ECO200H1", "at least 1.0 FCEs", "and"), labels(withText));
    }

    @Test
    void storedRequirementSurvivesRoundTrip() {
        Requirement requirement = new CreditCount("2.0", any(course("PHL100Y1"), new Grade("70%", course("PHL101H1"))));
        catalogService.register("PHL245H1", "Logic", requirement);

        assertEquals(requirement, catalogService.find("PHL245H1").requirement());
    }

    @Test
    void rejectsMissingAndUnknownRoots() {
        assertThrows(InvalidRequestException.class, () -> graphService.prerequisiteGraph(List.of(" "), null));
        assertThrows(CourseNotFoundException.class, () -> graphService.prerequisiteGraph(List.of("NOPE000H1"), null));
        assertThrows(CourseNotFoundException.class, () -> catalogService.find("NOPE000H1"));
        assertThrows(InvalidRequestException.class, () -> catalogService.register("", "Blank", none()));
    }

    @Test
    void requirementWithoutCourseNameIsNeverStored() {
        assertThrows(JsonProcessingException.class,
                () -> catalogService.register("BAD100H1", "Broken", objectMapper.readValue("{\"type\":\"SINGLE\"}", Requirement.class)));

        assertThrows(CourseNotFoundException.class, () -> catalogService.find("BAD100H1"));
        assertTrue(catalogService.findAll().stream().noneMatch(c -> c.code().equals("BAD100H1")));
    }

    @Test
    void listsRegisteredCoursesByCode() {
        catalogService.register("HIS109Y1", "Europe", none());
        catalogService.register("HIS103Y1", "Empires", course("HIS109Y1"));

        List<String> codes = catalogService.findAll().stream().map(c -> c.code()).toList();

        assertTrue(codes.indexOf("HIS103Y1") >= 0);
        assertTrue(codes.indexOf("HIS103Y1") < codes.indexOf("HIS109Y1"));
        assertEquals(codes.stream().sorted().toList(), codes);
    }

    @Test
    void buildsSampleGraph() {
        var graph = graphService.sampleGraph();

        assertEquals(10, graph.nodes().size());
        assertEquals(7, graph.edges().size());
        assertEquals(1, labels(graph).stream().filter("CSC148H1"::equals).count());
        assertEquals(GraphStyle.profileHash(), graphService.profileHash());
    }
}
