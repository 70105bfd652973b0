package com.coursereq.graph;

import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.HighSchoolCourse;
import com.coursereq.domain.RequirementModels.RequirementNode;
import com.coursereq.graph.CourseGraphModels.WeightedCourse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the courses a requirement tree points at, weighted by how mandatory each one is.
 *
 * <ul>
 *   <li>ALL_OF: every child keeps the parent value.</li>
 *   <li>ONE_OF: the parent value is split evenly across the alternatives.</li>
 *   <li>TWO_OF: twice the parent value is split across the alternatives.</li>
 * </ul>
 *
 * Counts, GPA thresholds, programs and free-text leaves produce nothing. Values are not rounded
 * here; rounding happens once, when a value becomes a link weight.
 */
@Component
public class RequirementWeightExtractor {

    public List<WeightedCourse> extractWeighted(RequirementNode tree) {
        return extractWeighted(tree, 1.0);
    }

    public List<WeightedCourse> extractWeighted(RequirementNode tree, double baseValue) {
        List<WeightedCourse> courses = new ArrayList<>();
        collect(tree, baseValue, courses);
        return courses;
    }

    private void collect(RequirementNode node, double value, List<WeightedCourse> out) {
        if (node instanceof CourseRef course) {
            out.add(new WeightedCourse(course.courseId(), value));
        } else if (node instanceof HighSchoolCourse hs) {
            out.add(new WeightedCourse(hs.courseId(), value));
        } else if (node instanceof Group group && !group.children().isEmpty()) {
            int n = group.children().size();
            double childValue = switch (group.logic()) {
                case ALL_OF -> value;
                case ONE_OF -> value / n;
                case TWO_OF -> (value * 2) / n;
            };
            for (RequirementNode child : group.children()) {
                collect(child, childValue, out);
            }
        }
    }

    public static double roundWeight(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
