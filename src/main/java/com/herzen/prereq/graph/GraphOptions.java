package com.herzen.prereq.graph;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

public record GraphOptions(Set<String> departments,
                           Set<String> locations,
                           boolean includeFreeText,
                           boolean includeGradeGates,
                           Set<String> taken,
                           int maxDepth) {
    public GraphOptions {
        departments = withoutNulls(departments);
        locations = withoutNulls(locations);
        taken = withoutNulls(taken);
    }

    private static Set<String> withoutNulls(Set<String> values) {
        if (values == null) return Set.of();
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    }

    public GraphOptions withDepartments(Set<String> value) {
        return new GraphOptions(value, locations, includeFreeText, includeGradeGates, taken, maxDepth);
    }

    public GraphOptions withLocations(Set<String> value) {
        return new GraphOptions(departments, value, includeFreeText, includeGradeGates, taken, maxDepth);
    }

    public GraphOptions withFreeText(boolean value) {
        return new GraphOptions(departments, locations, value, includeGradeGates, taken, maxDepth);
    }

    public GraphOptions withGradeGates(boolean value) {
        return new GraphOptions(departments, locations, includeFreeText, value, taken, maxDepth);
    }

    public GraphOptions withTaken(Set<String> value) {
        return new GraphOptions(departments, locations, includeFreeText, includeGradeGates, value, maxDepth);
    }

    public GraphOptions withMaxDepth(int value) {
        return new GraphOptions(departments, locations, includeFreeText, includeGradeGates, taken, value);
    }
}
