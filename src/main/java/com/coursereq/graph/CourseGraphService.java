package com.coursereq.graph;

import com.coursereq.graph.CourseGraphModels.CourseGraph;
import com.coursereq.graph.CourseGraphModels.DepartmentCount;
import com.coursereq.graph.CourseGraphModels.GraphLink;
import com.coursereq.graph.CourseGraphModels.GraphNode;
import com.coursereq.graph.CourseGraphModels.GraphStatistics;
import com.coursereq.graph.CourseGraphModels.HubCourse;
import com.coursereq.repository.RequirementJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CourseGraphService {
    private static final Logger log = LoggerFactory.getLogger(CourseGraphService.class);
    private static final int TOP_N = 10;
    private static final int DEEPEST_N = 5;

    private final RequirementJdbcRepository repository;
    private final CourseGraphAssembler assembler;
    private final GraphCsvCodec csvCodec;
    private final AtomicReference<CourseGraph> graphCache = new AtomicReference<>();

    public CourseGraphService(RequirementJdbcRepository repository, CourseGraphAssembler assembler, GraphCsvCodec csvCodec) {
        this.repository = repository;
        this.assembler = assembler;
        this.csvCodec = csvCodec;
    }

    public CourseGraph graph() {
        CourseGraph cached = graphCache.get();
        if (cached != null) return cached;

        CourseGraph graph = assembler.assemble(repository.loadAll());
        log.info("Assembled course graph nodes={} links={}", graph.nodes().size(), graph.links().size());
        graphCache.set(graph);
        return graph;
    }

    public void invalidate() {
        graphCache.set(null);
    }

    public String nodesCsv() {
        return csvCodec.writeNodes(graph().nodes());
    }

    public String linksCsv() {
        return csvCodec.writeLinks(graph().links());
    }

    public GraphStatistics statistics() {
        CourseGraph graph = graph();

        List<DepartmentCount> departments = graph.nodes().stream()
                .collect(Collectors.groupingBy(GraphNode::group, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new DepartmentCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(DepartmentCount::courses).reversed().thenComparing(DepartmentCount::department))
                .toList();

        Map<String, GraphNode> byId = graph.nodes().stream().collect(Collectors.toMap(GraphNode::id, Function.identity()));
        List<HubCourse> hubs = graph.links().stream()
                .collect(Collectors.groupingBy(GraphLink::source, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new HubCourse(e.getKey(), byId.containsKey(e.getKey()) ? byId.get(e.getKey()).title() : e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(HubCourse::dependentCourses).reversed().thenComparing(HubCourse::id))
                .limit(TOP_N)
                .toList();

        Map<Integer, Long> depthDistribution = graph.nodes().stream()
                .collect(Collectors.groupingBy(GraphNode::depth, TreeMap::new, Collectors.counting()));

        List<GraphNode> deepest = graph.nodes().stream()
                .filter(n -> n.depth() > 0)
                .sorted(Comparator.comparingInt(GraphNode::depth).reversed())
                .limit(DEEPEST_N)
                .toList();

        return new GraphStatistics(graph.nodes().size(), graph.links().size(), departments, hubs, depthDistribution, deepest);
    }
}
