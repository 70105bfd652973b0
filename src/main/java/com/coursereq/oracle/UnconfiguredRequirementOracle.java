package com.coursereq.oracle;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import org.springframework.stereotype.Component;

import java.util.List;

/** Stands in until a translation service is wired in; every course fails with the same reason. */
@Component
public class UnconfiguredRequirementOracle implements RequirementOracle {
    static final String REASON = "No requirement oracle is configured";

    @Override
    public OracleResponse translate(CatalogCourse course, List<String> previousErrors) {
        return OracleResponse.failure(REASON);
    }
}
