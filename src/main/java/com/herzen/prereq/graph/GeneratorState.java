package com.herzen.prereq.graph;

import com.herzen.prereq.graph.GraphModels.Attribute;
import com.herzen.prereq.graph.GraphModels.EdgeStatement;
import com.herzen.prereq.graph.GraphModels.NodeStatement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

class GeneratorState {
    private static final String COUNTER_INFIX = "_counter_";

    private long counter;
    private final Map<String, NodeStatement> nodesByName = new HashMap<>();

    NodeStatement makeNode(String name) {
        NodeStatement existing = nodesByName.get(name);
        if (existing != null) return existing;

        String nodeId = nextId(name);
        NodeStatement node = new NodeStatement(nodeId, List.of(
                new Attribute("label", name),
                new Attribute("id", nodeId)));
        nodesByName.put(name, node);
        return node;
    }

    NodeStatement makeBooleanNode(String label) {
        String nodeId = nextId(label);
        List<Attribute> attributes = new ArrayList<>();
        attributes.add(new Attribute("label", label));
        attributes.add(new Attribute("id", nodeId));
        attributes.addAll(GraphStyle.ELLIPSE_ATTRIBUTES);
        return new NodeStatement(nodeId, List.copyOf(attributes));
    }

    EdgeStatement makeEdge(String fromId, String toId) {
        return new EdgeStatement(fromId, toId, List.of(new Attribute("id", fromId + "|" + toId)));
    }

    long counter() {
        return counter;
    }

    private String nextId(String name) {
        return name + COUNTER_INFIX + counter++;
    }
}
