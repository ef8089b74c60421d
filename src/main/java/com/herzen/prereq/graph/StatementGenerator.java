package com.herzen.prereq.graph;

import com.herzen.prereq.graph.GraphModels.*;
import com.herzen.prereq.requirement.CourseRequirement;
import com.herzen.prereq.requirement.Requirement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Component
public class StatementGenerator {
    static final String HIGH_SCHOOL_MARKER = "High school";

    private final CourseFilter courseFilter;

    public StatementGenerator(CourseFilter courseFilter) {
        this.courseFilter = courseFilter;
    }

    public DotGraph generate(GraphOptions options, List<CourseRequirement> requirements) {
        GeneratorState state = new GeneratorState();
        List<GraphStatement> statements = new ArrayList<>();
        for (CourseRequirement requirement : requirements) {
            statements.addAll(courseStatements(options, state, requirement));
        }
        return GraphStyle.assemble(deduplicate(statements));
    }

    public static List<GraphStatement> deduplicate(List<? extends GraphStatement> statements) {
        return List.copyOf(new LinkedHashSet<>(statements));
    }

    List<GraphStatement> courseStatements(GraphOptions options, GeneratorState state, CourseRequirement requirement) {
        if (!courseFilter.shouldInclude(options, requirement.courseName())) return List.of();

        NodeStatement node = state.makeNode(requirement.courseName());
        List<GraphStatement> statements = new ArrayList<>();
        statements.add(node);
        statements.addAll(walk(options, state, node.id(), requirement.requirement()));
        return statements;
    }

    List<GraphStatement> walk(GraphOptions options, GeneratorState state, String parentId, Requirement req) {
        if (req instanceof Requirement.Single single) {
            return courseLeaf(options, state, parentId, single.courseName());
        }
        if (req instanceof Requirement.All all) {
            return gate(options, state, parentId, "and", all.children());
        }
        if (req instanceof Requirement.Any any) {
            return gate(options, state, parentId, "or", any.children());
        }
        if (req instanceof Requirement.Grade grade) {
            if (!options.includeGradeGates()) {
                return walk(options, state, parentId, grade.inner());
            }
            return labelledNode(options, state, parentId, grade.description(), grade.inner());
        }
        if (req instanceof Requirement.FreeText freeText) {
            return freeText(options, state, parentId, freeText.text());
        }
        if (req instanceof Requirement.CreditCount credits) {
            return labelledNode(options, state, parentId, "at least " + credits.amount() + " FCEs", credits.inner());
        }
        return List.of();
    }

    private List<GraphStatement> courseLeaf(GraphOptions options, GeneratorState state, String parentId, String courseName) {
        if (!courseFilter.shouldInclude(options, courseName)) return List.of();

        NodeStatement prereq = state.makeNode(courseName);
        return List.of(prereq, state.makeEdge(prereq.id(), parentId));
    }

    private List<GraphStatement> gate(GraphOptions options, GeneratorState state, String parentId,
                                      String label, List<Requirement> children) {
        if (!options.includeFreeText() && countMeaningful(children) < 2) {
            List<GraphStatement> flattened = new ArrayList<>();
            children.forEach(child -> flattened.addAll(walk(options, state, parentId, child)));
            return flattened;
        }

        NodeStatement gateNode = state.makeBooleanNode(label);
        EdgeStatement edge = state.makeEdge(gateNode.id(), parentId);
        List<GraphStatement> childStatements = new ArrayList<>();
        children.forEach(child -> childStatements.addAll(walk(options, state, gateNode.id(), child)));

        if (childStatements.size() <= 1) return List.of();

        List<GraphStatement> statements = new ArrayList<>();
        statements.add(gateNode);
        statements.add(edge);
        statements.addAll(childStatements);
        return statements;
    }

    private List<GraphStatement> labelledNode(GraphOptions options, GeneratorState state, String parentId,
                                              String label, Requirement inner) {
        NodeStatement node = state.makeNode(label);
        List<GraphStatement> statements = new ArrayList<>();
        statements.add(node);
        statements.add(state.makeEdge(node.id(), parentId));
        statements.addAll(walk(options, state, node.id(), inner));
        return statements;
    }

    private List<GraphStatement> freeText(GraphOptions options, GeneratorState state, String parentId, String text) {
        if (!options.includeFreeText() || text.isEmpty() || text.contains(HIGH_SCHOOL_MARKER)) return List.of();

        NodeStatement note = state.makeNode(text);
        return List.of(note, state.makeEdge(note.id(), parentId));
    }

    private static long countMeaningful(List<Requirement> children) {
        return children.stream().filter(Requirement::isMeaningful).count();
    }
}
