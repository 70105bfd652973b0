package com.coursereq.service;

import com.coursereq.domain.CatalogModels.BlacklistedCourse;
import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.repository.CatalogJdbcRepository;
import com.coursereq.repository.RequirementJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Progress of the translation run over the catalog. Only courses that carry requirement text are
 * counted.
 */
@Service
public class ParseStatisticsService {
    private final CatalogJdbcRepository catalogRepository;
    private final RequirementJdbcRepository requirementRepository;

    public ParseStatisticsService(CatalogJdbcRepository catalogRepository, RequirementJdbcRepository requirementRepository) {
        this.catalogRepository = catalogRepository;
        this.requirementRepository = requirementRepository;
    }

    public ParseStatistics statistics() {
        List<CatalogCourse> withRequirements = catalogRepository.loadCatalog().stream()
                .filter(CatalogCourse::hasRequirementText)
                .toList();

        Set<String> parsed = requirementRepository.loadAll().stream()
                .map(StoredCourseRequirements::courseId)
                .collect(Collectors.toSet());
        Set<String> blacklisted = catalogRepository.loadBlacklist().stream()
                .map(BlacklistedCourse::courseId)
                .collect(Collectors.toSet());
        Set<String> attempted = new HashSet<>(requirementRepository.loadAttemptedCourseIds());

        int successfullyParsed = 0, blacklistedCount = 0, attemptedCount = 0, covered = 0;
        for (CatalogCourse course : withRequirements) {
            String id = course.courseId();
            boolean isParsed = parsed.contains(id);
            boolean isBlacklisted = blacklisted.contains(id);
            boolean isAttempted = attempted.contains(id);

            if (isParsed) successfullyParsed++;
            if (isBlacklisted) blacklistedCount++;
            if (isAttempted) attemptedCount++;
            if (isParsed || isBlacklisted || isAttempted) covered++;
        }

        int total = withRequirements.size();
        return new ParseStatistics(total, successfullyParsed, blacklistedCount, attemptedCount, covered,
                total - covered, percentage(successfullyParsed, total), percentage(covered, total));
    }

    private static double percentage(int part, int total) {
        return total > 0 ? part * 100.0 / total : 0.0;
    }

    public record ParseStatistics(int totalCourses,
                                  int successfullyParsed,
                                  int blacklisted,
                                  int attempted,
                                  int covered,
                                  int notAttempted,
                                  double successPercentage,
                                  double coveragePercentage) {}
}
