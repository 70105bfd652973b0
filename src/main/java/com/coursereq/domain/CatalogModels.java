package com.coursereq.domain;

import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public class CatalogModels {
    public record CatalogCourse(String department,
                                String number,
                                String title,
                                String notes,
                                String prerequisites,
                                String corequisites) {
        public String courseId() {
            return department + " " + number;
        }

        public boolean hasRequirementText() {
            return !isBlank(prerequisites) || !isBlank(corequisites) || !isBlank(notes);
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }

    public record StoredCourseRequirements(ParsedCourseRequirements requirements,
                                           @JsonProperty("original_title") String originalTitle,
                                           @JsonProperty("original_prerequisites") String originalPrerequisites,
                                           @JsonProperty("original_corequisites") String originalCorequisites,
                                           @JsonProperty("original_notes") String originalNotes,
                                           Instant timestamp) {
        public String courseId() {
            return requirements.courseId();
        }

        public static StoredCourseRequirements of(ParsedCourseRequirements requirements, CatalogCourse source, Instant timestamp) {
            return new StoredCourseRequirements(requirements, source.title(), source.prerequisites(),
                    source.corequisites(), source.notes(), timestamp);
        }
    }

    public record BlacklistedCourse(String department, String number, String reason, Instant timestamp) {
        public String courseId() {
            return department + " " + number;
        }
    }
}
