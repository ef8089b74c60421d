package com.herzen.prereq.graph;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Optional;

public class GraphModels {
    public record Attribute(String name, String value) {}

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = GlobalAttributes.class, name = "attributes"),
            @JsonSubTypes.Type(value = NodeStatement.class, name = "node"),
            @JsonSubTypes.Type(value = EdgeStatement.class, name = "edge")
    })
    public interface GraphStatement {}

    public enum AttributeScope { GRAPH, NODE, EDGE }

    public record GlobalAttributes(AttributeScope scope, List<Attribute> attributes) implements GraphStatement {}

    public record NodeStatement(String id, List<Attribute> attributes) implements GraphStatement {
        public Optional<String> attribute(String name) {
            return attributes.stream().filter(a -> a.name().equals(name)).map(Attribute::value).findFirst();
        }
    }

    public record EdgeStatement(String from, String to, List<Attribute> attributes) implements GraphStatement {}

    public record DotGraph(boolean strict, boolean directed, String graphId, List<GraphStatement> statements) {
        public List<NodeStatement> nodes() {
            return statements.stream()
                    .filter(NodeStatement.class::isInstance)
                    .map(NodeStatement.class::cast)
                    .toList();
        }

        public List<EdgeStatement> edges() {
            return statements.stream()
                    .filter(EdgeStatement.class::isInstance)
                    .map(EdgeStatement.class::cast)
                    .toList();
        }
    }
}
