package com.herzen.prereq.api;

import com.herzen.prereq.graph.GraphModels.DotGraph;
import com.herzen.prereq.graph.GraphOptions;
import com.herzen.prereq.service.PrerequisiteGraphService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/graphs")
public class GraphController {
    private final PrerequisiteGraphService graphService;

    public GraphController(PrerequisiteGraphService graphService) {
        this.graphService = graphService;
    }

    @PostMapping("/prerequisites")
    public ResponseEntity<DotGraph> prerequisites(@RequestBody GraphRequest request) {
        return ResponseEntity.ok(graphService.prerequisiteGraph(request.courses(), request.toOptions(graphService.defaultOptions())));
    }

    @GetMapping("/sample")
    public ResponseEntity<DotGraph> sample() {
        return ResponseEntity.ok(graphService.sampleGraph());
    }

    @GetMapping("/profile-hash")
    public ResponseEntity<ProfileHash> profileHash() {
        return ResponseEntity.ok(new ProfileHash(graphService.profileHash()));
    }

    public record GraphRequest(List<String> courses,
                               Set<String> departments,
                               Set<String> locations,
                               Boolean includeFreeText,
                               Boolean includeGradeGates,
                               Set<String> taken,
                               Integer maxDepth) {
        GraphOptions toOptions(GraphOptions defaults) {
            GraphOptions options = defaults.withDepartments(departments).withLocations(locations).withTaken(taken);
            if (includeFreeText != null) options = options.withFreeText(includeFreeText);
            if (includeGradeGates != null) options = options.withGradeGates(includeGradeGates);
            if (maxDepth != null) options = options.withMaxDepth(maxDepth);
            return options;
        }
    }

    public record ProfileHash(String hash) {}
}
