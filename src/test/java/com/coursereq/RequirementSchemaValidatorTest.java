package com.coursereq;

import com.coursereq.validation.RequirementSchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class RequirementSchemaValidatorTest {
    @Autowired
    private RequirementSchemaValidator validator;
    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void acceptsCompleteRecord() throws Exception {
        var result = validator.validate(json("""
                {
                  "department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                  "prerequisite": {"type": "group", "logic": "ALL_OF", "children": [
                    {"type": "course", "department": "CMPT", "number": "125", "minGrade": "C-"},
                    {"type": "group", "logic": "ONE_OF", "children": [
                      {"type": "course", "department": "MACM", "number": "101", "orEquivalent": "true"},
                      {"type": "creditCount", "credits": 60, "department": ["CMPT", "MATH"], "level": "UD"},
                      {"type": "courseCount", "count": 1, "department": "CMPT", "level": "3XX"},
                      {"type": "HSCourse", "course": "Pre-Calculus 12", "minGrade": "B"}
                    ]}
                  ]},
                  "corequisite": {"type": "CGPA", "minCGPA": 2.4},
                  "recommended_prerequisite": {"type": "permission", "note": "Instructor approval"},
                  "credit_conflicts": [
                    {"type": "conflict_course", "department": "CMPT", "number": "226"},
                    {"type": "conflict_other", "note": "Any equivalent course"}
                  ]
                }
                """));
        assertTrue(result.isValid(), () -> String.join("\n", result.errors()));
    }

    @Test
    void singleMissingFieldReportsExactlyOnePathQualifiedError() throws Exception {
        var result = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"type": "group", "logic": "ALL_OF", "children": [
                   {"type": "course", "department": "CMPT", "number": "125"},
                   {"type": "course", "number": "101"}
                 ]}}
                """));
        assertEquals(List.of("prerequisite.children[1].department: Must be a string"), result.errors());
    }

    @Test
    void accumulatesEveryViolationInTraversalOrder() throws Exception {
        var result = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"type": "group", "logic": "SOME_OF", "children": [
                   {"type": "course", "department": "A", "number": "1", "canBeTakenConcurrently": "yes", "foo": 1},
                   {"type": "creditCount", "credits": "three"}
                 ]}}
                """));
        assertEquals(List.of(
                "prerequisite.logic: Must be 'ALL_OF', 'ONE_OF', or 'TWO_OF'",
                "prerequisite.children[0].canBeTakenConcurrently: Must be 'true' if provided",
                "prerequisite.children[0].foo: Unexpected property",
                "prerequisite.children[1].credits: Must be a number"), result.errors());
    }

    @Test
    void unknownTypeIsNotDescendedInto() throws Exception {
        var result = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "corequisite": {"type": "courses", "department": 5, "whatever": true}}
                """));
        assertEquals(List.of("corequisite.type: Invalid requirement type 'courses'"), result.errors());
    }

    @Test
    void missingTypeIsReported() throws Exception {
        var result = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"department": "CMPT", "number": "125"}}
                """));
        assertEquals(List.of("prerequisite.type: Must be a string"), result.errors());
    }

    @Test
    void rejectsEmptyGroupAndNonArrayChildren() throws Exception {
        var empty = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"type": "group", "logic": "ONE_OF", "children": []}}
                """));
        assertEquals(List.of("prerequisite.children: Must contain at least one child"), empty.errors());

        var notArray = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"type": "group", "logic": "ONE_OF", "children": {}}}
                """));
        assertEquals(List.of("prerequisite.children: Must be an array"), notArray.errors());
    }

    @Test
    void checksDepartmentListEntriesAndLevel() throws Exception {
        var result = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "prerequisite": {"type": "courseCount", "count": 2, "department": ["CMPT", 5], "level": "5XX"}}
                """));
        assertEquals(List.of(
                "prerequisite.department[1]: Must be a string",
                "prerequisite.level: Must be '1XX', '2XX', '3XX', '4XX', 'LD', or 'UD' if provided"), result.errors());
    }

    @Test
    void validatesEnvelope() throws Exception {
        assertEquals(List.of("Root: Must be an object"), validator.validate(json("[]")).errors());
        assertEquals(List.of("Root: Must be an object"), validator.validate(null).errors());

        var empty = validator.validate(json("{\"extra\": 1}"));
        assertEquals(List.of(
                "department: Must be a string",
                "number: Must be a string",
                "schema_version: Must be a string",
                "extra: Unexpected property"), empty.errors());
    }

    @Test
    void validatesCreditConflicts() throws Exception {
        var notArray = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "credit_conflicts": {"type": "conflict_other", "note": "x"}}
                """));
        assertEquals(List.of("credit_conflicts: Must be an array if provided"), notArray.errors());

        var badEntries = validator.validate(json("""
                {"department": "CMPT", "number": "225", "schema_version": "SFUv1.1",
                 "credit_conflicts": [{"type": "conflict_other"}, {"type": "conflict"}]}
                """));
        assertEquals(List.of(
                "credit_conflicts[0].note: Must be a string",
                "credit_conflicts[1].type: Must be either 'conflict_course' or 'conflict_other'"), badEntries.errors());
    }

    @Test
    void neverThrowsOnOddValues() throws Exception {
        var result = validator.validate(json("""
                {"department": null, "number": 225, "schema_version": [],
                 "prerequisite": "CMPT 125", "corequisite": {"type": "group", "children": [null, 3]}}
                """));
        assertFalse(result.isValid());
        assertTrue(result.errors().contains("prerequisite: Must be an object"));
        assertTrue(result.errors().contains("corequisite.logic: Must be a string"));
        assertTrue(result.errors().contains("corequisite.children[0]: Must be an object"));
        assertTrue(result.errors().contains("corequisite.children[1]: Must be an object"));
    }
}
