package com.coursereq.oracle;

import com.coursereq.domain.CatalogModels.CatalogCourse;

import java.util.List;

/**
 * Translates a course's free-text enrollment rules into a candidate requirement record.
 *
 * <p>Implementations call out to a text-understanding service. The candidate they return is
 * untrusted and is validated before anything is stored.
 */
@FunctionalInterface
public interface RequirementOracle {

    /**
     * @param course         the catalog listing whose text is to be translated
     * @param previousErrors schema errors reported for the previous attempt, empty on the first one
     */
    OracleResponse translate(CatalogCourse course, List<String> previousErrors);
}
