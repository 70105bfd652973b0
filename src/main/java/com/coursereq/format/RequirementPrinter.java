package com.coursereq.format;

import com.coursereq.domain.RequirementModels.CourseCount;
import com.coursereq.domain.RequirementModels.CourseLevel;
import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.CreditCount;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.GroupLogic;
import com.coursereq.domain.RequirementModels.HighSchoolCourse;
import com.coursereq.domain.RequirementModels.MinimumCgpa;
import com.coursereq.domain.RequirementModels.MinimumUdgpa;
import com.coursereq.domain.RequirementModels.Other;
import com.coursereq.domain.RequirementModels.Permission;
import com.coursereq.domain.RequirementModels.ProgramEnrollment;
import com.coursereq.domain.RequirementModels.RequirementNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders requirement trees for people reviewing a translation: {@link #pretty} as an indented
 * outline, {@link #readable} as running text close to catalog wording.
 */
@Component
public class RequirementPrinter {

    public String pretty(RequirementNode node) {
        return pretty(node, 0);
    }

    private String pretty(RequirementNode node, int indent) {
        String prefix = "  ".repeat(indent);

        if (node instanceof Group group) {
            List<String> lines = new ArrayList<>();
            lines.add(prefix + "Group (" + group.logic() + "):");
            group.children().forEach(child -> lines.add(pretty(child, indent + 1)));
            return String.join("\n", lines);
        }
        if (node instanceof CourseRef c) {
            return prefix + c.courseId()
                    + (c.minGrade() != null ? " (minimum \"" + c.minGrade() + "\")" : "")
                    + (c.canBeTakenConcurrently() != null ? " (can be taken concurrently)" : "")
                    + (c.orEquivalent() != null ? " (or equivalent)" : "");
        }
        if (node instanceof CreditCount c) {
            String departments = c.department() == null ? "" : String.join(", ", c.department());
            String level = c.level() != null ? " level " + c.level().label() : "";
            String concurrent = c.canBeTakenConcurrently() != null ? " (can be taken concurrently)" : "";
            String scope = departments.isEmpty() ? level : " in " + departments + level;
            return prefix + number(c.credits()) + " units" + scope + concurrent + ".";
        }
        if (node instanceof CourseCount c) {
            String departments = c.department() == null ? "any department" : String.join(", ", c.department());
            return prefix + number(c.count()) + " " + (c.count() == 1 ? "course" : "courses") + " from " + departments
                    + (c.level() != null ? " level " + c.level().label() : "")
                    + (c.minGrade() != null ? " (minimum \"" + c.minGrade() + "\")" : "")
                    + (c.canBeTakenConcurrently() != null ? " (can be taken concurrently)" : "");
        }
        if (node instanceof HighSchoolCourse hs) {
            return prefix + "High School: " + hs.course()
                    + (hs.minGrade() != null ? " (minimum \"" + hs.minGrade() + "\")" : "")
                    + (hs.orEquivalent() != null ? " (or equivalent)" : "");
        }
        return prefix + simpleLeaf(node, false);
    }

    public String readable(RequirementNode node) {
        if (node instanceof Group group) {
            if (group.logic() == GroupLogic.ALL_OF && group.children().size() == 2
                    && group.children().get(0) instanceof CreditCount credits
                    && isCourseBearing(group.children().get(1))) {
                return "At least " + readable(credits) + ", including " + removePeriod(readable(group.children().get(1))) + ".";
            }
            List<String> children = group.children().stream().map(this::readable).toList();
            return switch (group.logic()) {
                case ALL_OF -> children.stream().map(RequirementPrinter::ensurePeriod).collect(Collectors.joining(" "));
                case ONE_OF -> String.join(" or ", children);
                case TWO_OF -> "any two of: " + String.join(", ", children);
            };
        }
        if (node instanceof CourseRef c) {
            return c.courseId() + grade(c.minGrade()) + concurrent(c.canBeTakenConcurrently()) + equivalent(c.orEquivalent());
        }
        if (node instanceof CreditCount c) {
            return number(c.credits()) + " units"
                    + (c.department() == null ? "" : " of " + String.join(", ", c.department()))
                    + (c.level() != null ? " at level " + c.level().label() : "")
                    + grade(c.minGrade())
                    + concurrent(c.canBeTakenConcurrently());
        }
        if (node instanceof CourseCount c) {
            return courseCount(c);
        }
        if (node instanceof HighSchoolCourse hs) {
            return "High School: " + hs.course() + grade(hs.minGrade()) + equivalent(hs.orEquivalent());
        }
        return simpleLeaf(node, true);
    }

    private String courseCount(CourseCount c) {
        String level = levelWords(c.level());
        String tail = grade(c.minGrade()) + concurrent(c.canBeTakenConcurrently());

        if (c.count() == 1 && c.department() != null && c.department().size() == 1 && c.level() != null) {
            return "any " + level + " " + c.department().get(0) + " course" + tail;
        }
        String departments = c.department() == null ? "any department" : String.join(", ", c.department());
        return number(c.count()) + " " + (c.count() == 1 ? "course" : "courses")
                + (level.isEmpty() ? "" : " (" + level + ")")
                + " from " + departments + tail;
    }

    private static String simpleLeaf(RequirementNode node, boolean sentence) {
        if (node instanceof MinimumCgpa cgpa) {
            return (sentence ? "a CGPA of at least " : "CGPA of ") + number(cgpa.minCGPA());
        }
        if (node instanceof MinimumUdgpa udgpa) {
            return (sentence ? "an Upper Division GPA of at least " : "Upper Division GPA of ") + number(udgpa.minUDGPA());
        }
        if (node instanceof ProgramEnrollment p) return "Program: " + p.program();
        if (node instanceof Permission p) return "Permission: " + p.note();
        if (node instanceof Other o) return "Other: " + o.note();
        return "Unknown requirement type";
    }

    private static boolean isCourseBearing(RequirementNode node) {
        if (node instanceof CourseRef || node instanceof CreditCount) return true;
        if (node instanceof Group group) return group.children().stream().anyMatch(RequirementPrinter::isCourseBearing);
        return false;
    }

    private static String levelWords(CourseLevel level) {
        if (level == null) return "";
        return switch (level) {
            case LD -> "lower division";
            case UD -> "upper division";
            default -> "level " + level.label();
        };
    }

    private static String grade(String minGrade) {
        return minGrade != null ? " with a minimum grade of \"" + minGrade + "\"" : "";
    }

    private static String concurrent(String flag) {
        return flag != null ? " (can be taken concurrently)" : "";
    }

    private static String equivalent(String flag) {
        return flag != null ? " or equivalent" : "";
    }

    private static String ensurePeriod(String text) {
        return text.endsWith(".") ? text : text + ".";
    }

    private static String removePeriod(String text) {
        return text.endsWith(".") ? text.substring(0, text.length() - 1) : text;
    }

    private static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
