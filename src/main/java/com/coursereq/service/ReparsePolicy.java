package com.coursereq.service;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Decides whether a stored record still reflects its catalog listing. The comparison is on the
 * source text, character for character, never on the parsed tree.
 */
@Component
public class ReparsePolicy {
    private final String schemaVersion;

    public ReparsePolicy(@Value("${requirements.schema-version:SFUv1.1}") String schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String schemaVersion() {
        return schemaVersion;
    }

    public boolean needsReparsing(CatalogCourse course, StoredCourseRequirements existing) {
        return !Objects.equals(existing.originalTitle(), course.title())
                || !Objects.equals(existing.originalPrerequisites(), course.prerequisites())
                || !Objects.equals(existing.originalCorequisites(), course.corequisites())
                || !Objects.equals(existing.originalNotes(), course.notes())
                || !Objects.equals(existing.requirements().schemaVersion(), schemaVersion);
    }
}
