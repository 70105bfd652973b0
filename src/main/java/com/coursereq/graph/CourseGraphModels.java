package com.coursereq.graph;

import java.util.List;
import java.util.Map;

public class CourseGraphModels {
    public record WeightedCourse(String course, double value) {}

    public record GraphNode(String id, String title, String group, double size, int depth) {
        public GraphNode withSize(double newSize) {
            return new GraphNode(id, title, group, newSize, depth);
        }
    }

    public record GraphLink(String source, String target, double value) {}

    public record CourseGraph(List<GraphNode> nodes, List<GraphLink> links) {
        public CourseGraph {
            nodes = List.copyOf(nodes);
            links = List.copyOf(links);
        }
    }

    public record DepartmentCount(String department, long courses) {}

    public record HubCourse(String id, String title, long dependentCourses) {}

    public record GraphStatistics(int nodeCount,
                                  int linkCount,
                                  List<DepartmentCount> departments,
                                  List<HubCourse> topPrerequisites,
                                  Map<Integer, Long> depthDistribution,
                                  List<GraphNode> deepestCourses) {}
}
