package com.coursereq.graph;

import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.HighSchoolCourse;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementModels.RequirementNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts the prerequisite layers that stand between having nothing and being eligible.
 *
 * <p>Depths are computed in listing order, not topological order: a course whose prerequisite is
 * listed later reads that prerequisite as depth 0. Unknown courses and courses without
 * prerequisites are both depth 0 and are left out when a group compares its branches.
 */
@Component
public class PrerequisiteDepthCalculator {

    public int depthOf(RequirementNode tree, Map<String, Integer> knownDepths) {
        if (tree instanceof CourseRef course) {
            return knownDepths.getOrDefault(course.courseId(), 0) + 1;
        }
        if (tree instanceof HighSchoolCourse) {
            return 1;
        }
        if (tree instanceof Group group) {
            List<Integer> depths = group.children().stream()
                    .map(child -> depthOf(child, knownDepths))
                    .filter(d -> d > 0)
                    .sorted()
                    .toList();
            if (depths.isEmpty()) return 0;

            return switch (group.logic()) {
                case ALL_OF -> depths.get(depths.size() - 1);
                case ONE_OF -> depths.get(0);
                // with a single qualifying branch left, that branch bounds the group
                case TWO_OF -> depths.size() >= 2 ? depths.get(1) : depths.get(0);
            };
        }
        return 0;
    }

    /**
     * Depth of every record's own course, keyed by {@code "DEPT NUM"}, in listing order.
     */
    public Map<String, Integer> computeDepths(List<ParsedCourseRequirements> records) {
        Map<String, Integer> depths = new LinkedHashMap<>();
        records.forEach(r -> depths.put(r.courseId(), 0));

        for (ParsedCourseRequirements record : records) {
            int depth = 0;
            if (record.prerequisite() != null) {
                depth = Math.max(depth, depthOf(record.prerequisite(), depths));
            }
            if (record.corequisite() != null) {
                depth = Math.max(depth, depthOf(record.corequisite(), depths));
            }
            depths.put(record.courseId(), depth);
        }
        return depths;
    }
}
