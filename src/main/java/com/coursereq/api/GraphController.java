package com.coursereq.api;

import com.coursereq.graph.CourseGraphModels;
import com.coursereq.graph.CourseGraphService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/graph")
public class GraphController {
    private static final MediaType CSV = MediaType.parseMediaType("text/csv");

    private final CourseGraphService graphService;

    public GraphController(CourseGraphService graphService) {
        this.graphService = graphService;
    }

    @GetMapping
    public ResponseEntity<CourseGraphModels.CourseGraph> graph() {
        return ResponseEntity.ok(graphService.graph());
    }

    @GetMapping("/nodes.csv")
    public ResponseEntity<String> nodes() {
        return ResponseEntity.ok().contentType(CSV).body(graphService.nodesCsv());
    }

    @GetMapping("/links.csv")
    public ResponseEntity<String> links() {
        return ResponseEntity.ok().contentType(CSV).body(graphService.linksCsv());
    }

    @GetMapping("/statistics")
    public ResponseEntity<CourseGraphModels.GraphStatistics> statistics() {
        return ResponseEntity.ok(graphService.statistics());
    }
}
