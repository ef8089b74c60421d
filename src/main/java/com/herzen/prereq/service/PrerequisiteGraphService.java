package com.herzen.prereq.service;

import com.herzen.prereq.config.GraphDefaultsProperties;
import com.herzen.prereq.exception.InvalidRequestException;
import com.herzen.prereq.graph.GraphModels.DotGraph;
import com.herzen.prereq.graph.GraphOptions;
import com.herzen.prereq.graph.GraphStyle;
import com.herzen.prereq.graph.StatementGenerator;
import com.herzen.prereq.lookup.CourseFinder;
import com.herzen.prereq.requirement.CourseRequirement;
import com.herzen.prereq.requirement.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;

@Service
public class PrerequisiteGraphService {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteGraphService.class);

    private static final List<CourseRequirement> SAMPLE_COURSES = List.of(
            new CourseRequirement("MAT237H1", Requirement.course("MAT137H1")),
            new CourseRequirement("MAT133H1", Requirement.none()),
            new CourseRequirement("CSC148H1", Requirement.all(Requirement.course("CSC108H1"), Requirement.course("CSC104H1"))),
            new CourseRequirement("CSC265H1", Requirement.all(Requirement.course("CSC148H1"), Requirement.course("CSC236H1")))
    );

    private final CourseFinder courseFinder;
    private final StatementGenerator generator;
    private final GraphDefaultsProperties defaults;

    public PrerequisiteGraphService(CourseFinder courseFinder,
                                    StatementGenerator generator,
                                    GraphDefaultsProperties defaults) {
        this.courseFinder = courseFinder;
        this.generator = generator;
        this.defaults = defaults;
    }

    public DotGraph prerequisiteGraph(List<String> rootCourses, GraphOptions options) {
        List<String> roots = rootCourses == null ? List.of() : rootCourses.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        if (roots.isEmpty()) {
            throw new InvalidRequestException("At least one root course is required");
        }
        GraphOptions effective = options == null ? defaultOptions() : options;

        SortedMap<String, Requirement> requirements = courseFinder.lookupCourses(effective, roots);
        DotGraph graph = generator.generate(effective, CourseRequirement.fromMap(requirements));
        log.info("Built prerequisite graph for {}: {} course(s), {} node(s), {} edge(s)",
                roots, requirements.size(), graph.nodes().size(), graph.edges().size());
        return graph;
    }

    public DotGraph sampleGraph() {
        return generator.generate(defaultOptions(), SAMPLE_COURSES);
    }

    public String profileHash() {
        return GraphStyle.profileHash();
    }

    public GraphOptions defaultOptions() {
        return defaults.toOptions();
    }
}
