package com.herzen.prereq.config;

import com.herzen.prereq.graph.GraphOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

@ConfigurationProperties(prefix = "prereq-graph.defaults")
public record GraphDefaultsProperties(boolean includeFreeText, boolean includeGradeGates, int maxDepth) {

    public GraphOptions toOptions() {
        return new GraphOptions(Set.of(), Set.of(), includeFreeText, includeGradeGates, Set.of(), maxDepth);
    }
}
