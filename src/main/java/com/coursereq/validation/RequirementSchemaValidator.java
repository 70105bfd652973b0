package com.coursereq.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural check of untrusted requirement JSON, as returned by the translation oracle.
 *
 * <p>Every violation found during a full traversal is reported, each prefixed with the dotted path
 * of the offending value (for example {@code prerequisite.children[1].department}). Validation
 * never throws and never stops at the first error; only a node whose discriminator is missing or
 * unknown is not descended into.
 */
@Component
public class RequirementSchemaValidator {

    private static final Set<String> GROUP_LOGICS = Set.of("ALL_OF", "ONE_OF", "TWO_OF");
    private static final Set<String> LEVELS = Set.of("1XX", "2XX", "3XX", "4XX", "LD", "UD");

    private static final Map<String, Set<String>> NODE_PROPERTIES = Map.of(
            "group", Set.of("type", "logic", "children"),
            "course", Set.of("type", "department", "number", "minGrade", "canBeTakenConcurrently", "orEquivalent"),
            "HSCourse", Set.of("type", "course", "minGrade", "orEquivalent"),
            "creditCount", Set.of("type", "credits", "department", "level", "minGrade", "canBeTakenConcurrently"),
            "courseCount", Set.of("type", "count", "department", "level", "minGrade", "canBeTakenConcurrently"),
            "CGPA", Set.of("type", "minCGPA"),
            "UDGPA", Set.of("type", "minUDGPA"),
            "program", Set.of("type", "program"),
            "permission", Set.of("type", "note"),
            "other", Set.of("type", "note"));

    private static final Map<String, Set<String>> CONFLICT_PROPERTIES = Map.of(
            "conflict_course", Set.of("type", "department", "number", "title"),
            "conflict_other", Set.of("type", "note"));

    public static final List<String> TREE_FIELDS = List.of(
            "prerequisite", "corequisite", "recommended_prerequisite", "recommended_corequisite");

    private static final Set<String> ENVELOPE_PROPERTIES = Set.of(
            "department", "number", "schema_version",
            "prerequisite", "corequisite", "recommended_prerequisite", "recommended_corequisite",
            "credit_conflicts");

    /**
     * Result of a structural check.
     *
     * @param errors path-qualified violations, empty when the candidate is valid
     */
    public record ValidationResult(List<String> errors) {
        public ValidationResult {
            errors = List.copyOf(errors);
        }

        @JsonProperty("valid")
        public boolean isValid() {
            return errors.isEmpty();
        }

        public static ValidationResult invalid(String error) {
            return new ValidationResult(List.of(error));
        }
    }

    /**
     * Validate a whole per-course record envelope.
     */
    public ValidationResult validate(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            return ValidationResult.invalid("Root: Must be an object");
        }
        List<String> errors = new ArrayList<>();

        requireString(candidate, "department", "", errors);
        requireString(candidate, "number", "", errors);
        requireString(candidate, "schema_version", "", errors);

        for (String field : TREE_FIELDS) {
            if (candidate.has(field)) {
                errors.addAll(validateRequirementNode(candidate.get(field), field));
            }
        }

        if (candidate.has("credit_conflicts")) {
            JsonNode conflicts = candidate.get("credit_conflicts");
            if (!conflicts.isArray()) {
                errors.add("credit_conflicts: Must be an array if provided");
            } else {
                for (int i = 0; i < conflicts.size(); i++) {
                    errors.addAll(validateCreditConflict(conflicts.get(i), "credit_conflicts[" + i + "]"));
                }
            }
        }

        rejectUnexpected(candidate, ENVELOPE_PROPERTIES, "", errors);
        return new ValidationResult(errors);
    }

    /**
     * Validate a single requirement tree rooted at {@code path}.
     */
    public List<String> validateRequirementNode(JsonNode node, String path) {
        List<String> errors = new ArrayList<>();
        if (node == null || !node.isObject()) {
            errors.add(path + ": Must be an object");
            return errors;
        }

        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            errors.add(path + ".type: Must be a string");
            return errors;
        }
        Set<String> allowed = NODE_PROPERTIES.get(type.asText());
        if (allowed == null) {
            errors.add(path + ".type: Invalid requirement type '" + type.asText() + "'");
            return errors;
        }

        switch (type.asText()) {
            case "group" -> validateGroup(node, path, errors);
            case "course" -> {
                requireString(node, "department", path, errors);
                requireString(node, "number", path, errors);
                optionalString(node, "minGrade", path, errors);
                optionalFlag(node, "canBeTakenConcurrently", path, errors);
                optionalFlag(node, "orEquivalent", path, errors);
            }
            case "HSCourse" -> {
                requireString(node, "course", path, errors);
                optionalString(node, "minGrade", path, errors);
                optionalFlag(node, "orEquivalent", path, errors);
            }
            case "creditCount" -> validateCollection(node, "credits", path, errors);
            case "courseCount" -> validateCollection(node, "count", path, errors);
            case "CGPA" -> requireNumber(node, "minCGPA", path, errors);
            case "UDGPA" -> requireNumber(node, "minUDGPA", path, errors);
            case "program" -> requireString(node, "program", path, errors);
            case "permission", "other" -> requireString(node, "note", path, errors);
        }

        rejectUnexpected(node, allowed, path, errors);
        return errors;
    }

    /**
     * Validate a single credit-conflict entry rooted at {@code path}.
     */
    public List<String> validateCreditConflict(JsonNode conflict, String path) {
        List<String> errors = new ArrayList<>();
        if (conflict == null || !conflict.isObject()) {
            errors.add(path + ": Must be an object");
            return errors;
        }

        JsonNode type = conflict.get("type");
        if (type == null || !type.isTextual()) {
            errors.add(path + ".type: Must be a string");
            return errors;
        }
        Set<String> allowed = CONFLICT_PROPERTIES.get(type.asText());
        if (allowed == null) {
            errors.add(path + ".type: Must be either 'conflict_course' or 'conflict_other'");
            return errors;
        }

        if ("conflict_course".equals(type.asText())) {
            requireString(conflict, "department", path, errors);
            requireString(conflict, "number", path, errors);
            optionalString(conflict, "title", path, errors);
        } else {
            requireString(conflict, "note", path, errors);
        }

        rejectUnexpected(conflict, allowed, path, errors);
        return errors;
    }

    private void validateGroup(JsonNode node, String path, List<String> errors) {
        JsonNode logic = node.get("logic");
        if (logic == null || !logic.isTextual()) {
            errors.add(path + ".logic: Must be a string");
        } else if (!GROUP_LOGICS.contains(logic.asText())) {
            errors.add(path + ".logic: Must be 'ALL_OF', 'ONE_OF', or 'TWO_OF'");
        }

        JsonNode children = node.get("children");
        if (children == null || !children.isArray()) {
            errors.add(path + ".children: Must be an array");
            return;
        }
        if (children.isEmpty()) {
            errors.add(path + ".children: Must contain at least one child");
        }
        for (int i = 0; i < children.size(); i++) {
            errors.addAll(validateRequirementNode(children.get(i), path + ".children[" + i + "]"));
        }
    }

    // creditCount and courseCount share everything but the name of their threshold
    private void validateCollection(JsonNode node, String threshold, String path, List<String> errors) {
        requireNumber(node, threshold, path, errors);

        if (node.has("department")) {
            JsonNode department = node.get("department");
            if (department.isArray()) {
                for (int i = 0; i < department.size(); i++) {
                    if (!department.get(i).isTextual()) {
                        errors.add(path + ".department[" + i + "]: Must be a string");
                    }
                }
            } else if (!department.isTextual()) {
                errors.add(path + ".department: Must be a string or array of strings if provided");
            }
        }
        if (node.has("level")) {
            JsonNode level = node.get("level");
            if (!level.isTextual() || !LEVELS.contains(level.asText())) {
                errors.add(path + ".level: Must be '1XX', '2XX', '3XX', '4XX', 'LD', or 'UD' if provided");
            }
        }
        optionalString(node, "minGrade", path, errors);
        optionalFlag(node, "canBeTakenConcurrently", path, errors);
    }

    private static void requireString(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            errors.add(qualify(path, field) + ": Must be a string");
        }
    }

    private static void requireNumber(JsonNode node, String field, String path, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            errors.add(qualify(path, field) + ": Must be a number");
        }
    }

    private static void optionalString(JsonNode node, String field, String path, List<String> errors) {
        if (node.has(field) && !node.get(field).isTextual()) {
            errors.add(qualify(path, field) + ": Must be a string if provided");
        }
    }

    private static void optionalFlag(JsonNode node, String field, String path, List<String> errors) {
        if (!node.has(field)) return;
        JsonNode value = node.get(field);
        if (!value.isTextual() || !"true".equals(value.asText())) {
            errors.add(qualify(path, field) + ": Must be 'true' if provided");
        }
    }

    private static void rejectUnexpected(JsonNode node, Set<String> allowed, String path, List<String> errors) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!allowed.contains(name)) {
                errors.add(qualify(path, name) + ": Unexpected property");
            }
        }
    }

    private static String qualify(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }
}
