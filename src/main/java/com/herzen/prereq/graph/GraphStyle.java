package com.herzen.prereq.graph;

import com.herzen.prereq.graph.GraphModels.*;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class GraphStyle {
    public static final GlobalAttributes GRAPH_ATTRIBUTES = new GlobalAttributes(AttributeScope.GRAPH, List.of(
            new Attribute("rankdir", "TB"),
            new Attribute("splines", "ortho"),
            new Attribute("concentrate", "false")
    ));

    public static final GlobalAttributes NODE_ATTRIBUTES = new GlobalAttributes(AttributeScope.NODE, List.of(
            new Attribute("shape", "box"),
            new Attribute("fixedsize", "false"),
            new Attribute("style", "filled")
    ));

    public static final GlobalAttributes EDGE_ATTRIBUTES = new GlobalAttributes(AttributeScope.EDGE, List.of(
            new Attribute("arrowhead", "normal")
    ));

    public static final List<Attribute> ELLIPSE_ATTRIBUTES = List.of(
            new Attribute("shape", "ellipse"),
            new Attribute("width", "0.2"),
            new Attribute("height", "0.15"),
            new Attribute("fixedsize", "true"),
            new Attribute("fillcolor", "white"),
            new Attribute("fontsize", "6.0")
    );

    private static final String PROFILE_HASH = DigestUtils.md5DigestAsHex(
            (assemble(List.of()).toString() + ELLIPSE_ATTRIBUTES).getBytes(StandardCharsets.UTF_8));

    private GraphStyle() {}

    public static DotGraph assemble(List<? extends GraphStatement> statements) {
        List<GraphStatement> all = new ArrayList<>(statements.size() + 3);
        all.add(GRAPH_ATTRIBUTES);
        all.add(NODE_ATTRIBUTES);
        all.add(EDGE_ATTRIBUTES);
        all.addAll(statements);
        return new DotGraph(false, true, null, List.copyOf(all));
    }

    public static String profileHash() {
        return PROFILE_HASH;
    }
}
