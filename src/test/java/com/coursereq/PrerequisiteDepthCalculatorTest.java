package com.coursereq;

import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.GroupLogic;
import com.coursereq.domain.RequirementModels.HighSchoolCourse;
import com.coursereq.domain.RequirementModels.MinimumCgpa;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementModels.Permission;
import com.coursereq.graph.PrerequisiteDepthCalculator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteDepthCalculatorTest {
    private final PrerequisiteDepthCalculator calculator = new PrerequisiteDepthCalculator();

    private static CourseRef course(String id) {
        String[] parts = id.split(" ");
        return new CourseRef(parts[0], parts[1]);
    }

    @Test
    void leafDepths() {
        assertEquals(1, calculator.depthOf(course("CMPT 120"), Map.of()));
        assertEquals(3, calculator.depthOf(course("CMPT 225"), Map.of("CMPT 225", 2)));
        assertEquals(1, calculator.depthOf(new HighSchoolCourse("Math 12"), Map.of()));
        assertEquals(0, calculator.depthOf(new MinimumCgpa(2.0), Map.of()));
    }

    @Test
    void groupsPickBranchByLogic() {
        Map<String, Integer> known = Map.of("A 1", 1, "B 1", 3, "C 1", 4, "D 1", 6);

        var oneOf = new Group(GroupLogic.ONE_OF, List.of(course("A 1"), course("B 1")));
        assertEquals(2, calculator.depthOf(oneOf, known));

        var allOf = new Group(GroupLogic.ALL_OF, List.of(course("C 1"), course("E 1")));
        assertEquals(5, calculator.depthOf(allOf, known));

        // branches 5, 1 and 7: the second smallest is the cheapest way to satisfy two
        var twoOf = new Group(GroupLogic.TWO_OF, List.of(course("C 1"), course("E 1"), course("D 1")));
        assertEquals(5, calculator.depthOf(twoOf, known));
    }

    @Test
    void twoOfWithSingleQualifyingBranchUsesIt() {
        var twoOf = new Group(GroupLogic.TWO_OF, List.of(course("A 1"), new MinimumCgpa(2.0), new Permission("x")));
        assertEquals(3, calculator.depthOf(twoOf, Map.of("A 1", 2)));
    }

    @Test
    void groupWithoutCoursesIsZero() {
        var group = new Group(GroupLogic.ALL_OF, List.of(new MinimumCgpa(2.0), new Permission("x")));
        assertEquals(0, calculator.depthOf(group, Map.of()));
        assertEquals(0, calculator.depthOf(new Group(GroupLogic.ONE_OF, List.of()), Map.of()));
    }

    @Test
    void computesDepthsInListingOrder() {
        var records = List.of(
                new ParsedCourseRequirements("CMPT", "120", "SFUv1.1", null, null),
                new ParsedCourseRequirements("CMPT", "125", "SFUv1.1", course("CMPT 120"), null),
                new ParsedCourseRequirements("CMPT", "225", "SFUv1.1", course("CMPT 125"), null));
        assertEquals(Map.of("CMPT 120", 0, "CMPT 125", 1, "CMPT 225", 2), calculator.computeDepths(records));
    }

    @Test
    void laterListedPrerequisiteReadsAsZero() {
        var records = List.of(
                new ParsedCourseRequirements("CMPT", "225", "SFUv1.1", course("CMPT 125"), null),
                new ParsedCourseRequirements("CMPT", "125", "SFUv1.1", course("CMPT 120"), null));
        var depths = calculator.computeDepths(records);
        assertEquals(1, depths.get("CMPT 225"));
        assertEquals(1, depths.get("CMPT 125"));
        assertEquals(List.of("CMPT 225", "CMPT 125"), List.copyOf(depths.keySet()));
    }

    @Test
    void corequisiteCanDeepenCourse() {
        var records = List.of(
                new ParsedCourseRequirements("CMPT", "125", "SFUv1.1", course("CMPT 120"), null),
                new ParsedCourseRequirements("CMPT", "127", "SFUv1.1", course("MACM 101"), course("CMPT 125")));
        assertEquals(2, calculator.computeDepths(records).get("CMPT 127"));
    }
}
