package com.coursereq.graph;

import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementModels.RequirementNode;
import com.coursereq.graph.CourseGraphModels.CourseGraph;
import com.coursereq.graph.CourseGraphModels.GraphLink;
import com.coursereq.graph.CourseGraphModels.GraphNode;
import com.coursereq.graph.CourseGraphModels.WeightedCourse;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles schema-valid requirement records into one deduplicated course graph.
 *
 * <p>Links run from a prerequisite or corequisite to the course that needs it. A pair reached
 * through several requirement paths keeps its highest weight. Nodes without any link are pruned,
 * and the remaining nodes are sized by out-degree on a log scale between 1.00 and 3.00, rounded up
 * to the next 0.20 step.
 */
@Component
public class CourseGraphAssembler {
    static final double MIN_SIZE = 1.0;
    static final double MAX_SIZE = 3.0;
    private static final double SIZE_STEPS_PER_UNIT = 5.0;

    private final RequirementWeightExtractor extractor;
    private final PrerequisiteDepthCalculator depthCalculator;

    public CourseGraphAssembler(RequirementWeightExtractor extractor, PrerequisiteDepthCalculator depthCalculator) {
        this.extractor = extractor;
        this.depthCalculator = depthCalculator;
    }

    public CourseGraph assemble(List<StoredCourseRequirements> stored) {
        Map<String, String> titles = new HashMap<>();
        stored.forEach(s -> titles.put(s.courseId(), s.originalTitle()));
        return assemble(stored.stream().map(StoredCourseRequirements::requirements).toList(), titles);
    }

    public CourseGraph assemble(List<ParsedCourseRequirements> records, Map<String, String> titles) {
        records.forEach(CourseGraphAssembler::checkContract);

        Map<String, Integer> depths = depthCalculator.computeDepths(records);
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<String, GraphLink> links = new LinkedHashMap<>();

        for (ParsedCourseRequirements record : records) {
            String targetId = record.courseId();
            nodes.computeIfAbsent(targetId, id -> new GraphNode(id, titleOrId(titles, id),
                    record.department(), MIN_SIZE, depths.getOrDefault(id, 0)));

            mergeLinks(record.prerequisite(), targetId, titles, depths, nodes, links);
            mergeLinks(record.corequisite(), targetId, titles, depths, nodes, links);
        }

        Set<String> linked = new HashSet<>();
        Map<String, Integer> outDegree = new HashMap<>();
        for (GraphLink link : links.values()) {
            linked.add(link.source());
            linked.add(link.target());
            outDegree.merge(link.source(), 1, Integer::sum);
        }
        int maxOutDegree = outDegree.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        List<GraphNode> sized = nodes.values().stream()
                .filter(n -> linked.contains(n.id()))
                .map(n -> n.withSize(nodeSize(outDegree.getOrDefault(n.id(), 0), maxOutDegree)))
                .toList();

        return new CourseGraph(sized, List.copyOf(links.values()));
    }

    private void mergeLinks(RequirementNode tree, String targetId, Map<String, String> titles,
                            Map<String, Integer> depths, Map<String, GraphNode> nodes, Map<String, GraphLink> links) {
        if (tree == null) return;

        for (WeightedCourse weighted : extractor.extractWeighted(tree, 1.0)) {
            String sourceId = weighted.course();
            nodes.computeIfAbsent(sourceId, id -> new GraphNode(id, titleOrId(titles, id), groupOf(id),
                    MIN_SIZE, depths.getOrDefault(id, 0)));

            double value = RequirementWeightExtractor.roundWeight(weighted.value());
            String key = sourceId + "->" + targetId;
            GraphLink existing = links.get(key);
            if (existing == null || existing.value() < value) {
                links.put(key, new GraphLink(sourceId, targetId, value));
            }
        }
    }

    static double nodeSize(int outDegree, int maxOutDegree) {
        if (outDegree == 0) return MIN_SIZE;

        double scaled = MIN_SIZE + (2 * Math.log(outDegree + 1) / Math.log(maxOutDegree + 1));
        double clamped = Math.max(MIN_SIZE, Math.min(MAX_SIZE, scaled));
        // snap up to the 0.20 grid; the epsilon keeps exact grid values from drifting a step up
        double roundedUp = Math.ceil(clamped * SIZE_STEPS_PER_UNIT - 1e-9) / SIZE_STEPS_PER_UNIT;
        return Math.round(roundedUp * 100) / 100.0;
    }

    private static String titleOrId(Map<String, String> titles, String id) {
        String title = titles.get(id);
        return title == null || title.isBlank() ? id : title;
    }

    private static String groupOf(String id) {
        int space = id.indexOf(' ');
        String department = space < 0 ? id : id.substring(0, space);
        return department.isEmpty() ? "UNKNOWN" : department;
    }

    private static void checkContract(ParsedCourseRequirements record) {
        if (record == null || record.department() == null || record.number() == null) {
            throw new IllegalArgumentException("Graph input must be schema-valid, got " + record);
        }
    }
}
