package com.coursereq.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Requirement trees as they are exchanged with the translation oracle and stored per course.
 *
 * <p>Every variant is a record; {@link RequirementNode} and {@link CreditConflict} are sealed so a
 * switch over them is closed. Optional string flags keep their raw {@code "true"} form.
 */
public class RequirementModels {

    public static final String FLAG_TRUE = "true";

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Group.class, name = "group"),
            @JsonSubTypes.Type(value = CourseRef.class, name = "course"),
            @JsonSubTypes.Type(value = HighSchoolCourse.class, name = "HSCourse"),
            @JsonSubTypes.Type(value = CreditCount.class, name = "creditCount"),
            @JsonSubTypes.Type(value = CourseCount.class, name = "courseCount"),
            @JsonSubTypes.Type(value = MinimumCgpa.class, name = "CGPA"),
            @JsonSubTypes.Type(value = MinimumUdgpa.class, name = "UDGPA"),
            @JsonSubTypes.Type(value = ProgramEnrollment.class, name = "program"),
            @JsonSubTypes.Type(value = Permission.class, name = "permission"),
            @JsonSubTypes.Type(value = Other.class, name = "other")
    })
    public sealed interface RequirementNode
            permits Group, CourseRef, HighSchoolCourse, CreditCount, CourseCount,
            MinimumCgpa, MinimumUdgpa, ProgramEnrollment, Permission, Other {}

    public enum GroupLogic { ALL_OF, ONE_OF, TWO_OF }

    public enum CourseLevel {
        @JsonProperty("1XX") LEVEL_1XX("1XX"),
        @JsonProperty("2XX") LEVEL_2XX("2XX"),
        @JsonProperty("3XX") LEVEL_3XX("3XX"),
        @JsonProperty("4XX") LEVEL_4XX("4XX"),
        @JsonProperty("LD") LD("LD"),
        @JsonProperty("UD") UD("UD");

        private final String label;

        CourseLevel(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        public static Optional<CourseLevel> fromLabel(String label) {
            return Arrays.stream(values()).filter(l -> l.label.equals(label)).findFirst();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Group(GroupLogic logic, List<RequirementNode> children) implements RequirementNode {
        public Group {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CourseRef(String department,
                            String number,
                            String minGrade,
                            String canBeTakenConcurrently,
                            String orEquivalent) implements RequirementNode {
        public CourseRef(String department, String number) {
            this(department, number, null, null, null);
        }

        public String courseId() {
            return department + " " + number;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record HighSchoolCourse(String course, String minGrade, String orEquivalent) implements RequirementNode {
        public HighSchoolCourse(String course) {
            this(course, null, null);
        }

        public String courseId() {
            return "HS " + course;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreditCount(double credits,
                              @JsonFormat(with = {JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY,
                                      JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED})
                              List<String> department,
                              CourseLevel level,
                              String minGrade,
                              String canBeTakenConcurrently) implements RequirementNode {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CourseCount(double count,
                              @JsonFormat(with = {JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY,
                                      JsonFormat.Feature.WRITE_SINGLE_ELEM_ARRAYS_UNWRAPPED})
                              List<String> department,
                              CourseLevel level,
                              String minGrade,
                              String canBeTakenConcurrently) implements RequirementNode {}

    public record MinimumCgpa(@JsonProperty("minCGPA") double minCGPA) implements RequirementNode {}

    public record MinimumUdgpa(@JsonProperty("minUDGPA") double minUDGPA) implements RequirementNode {}

    public record ProgramEnrollment(String program) implements RequirementNode {}

    public record Permission(String note) implements RequirementNode {}

    public record Other(String note) implements RequirementNode {}

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = ConflictCourse.class, name = "conflict_course"),
            @JsonSubTypes.Type(value = ConflictOther.class, name = "conflict_other")
    })
    public sealed interface CreditConflict permits ConflictCourse, ConflictOther {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConflictCourse(String department, String number, String title) implements CreditConflict {}

    public record ConflictOther(String note) implements CreditConflict {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ParsedCourseRequirements(String department,
                                           String number,
                                           @JsonProperty("schema_version") String schemaVersion,
                                           RequirementNode prerequisite,
                                           RequirementNode corequisite,
                                           @JsonProperty("recommended_prerequisite") RequirementNode recommendedPrerequisite,
                                           @JsonProperty("recommended_corequisite") RequirementNode recommendedCorequisite,
                                           @JsonProperty("credit_conflicts") List<CreditConflict> creditConflicts) {
        public ParsedCourseRequirements(String department, String number, String schemaVersion,
                                        RequirementNode prerequisite, RequirementNode corequisite) {
            this(department, number, schemaVersion, prerequisite, corequisite, null, null, null);
        }

        public String courseId() {
            return department + " " + number;
        }
    }
}
