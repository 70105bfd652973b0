package com.coursereq.service;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.graph.CourseGraphService;
import com.coursereq.oracle.OracleResponse;
import com.coursereq.oracle.RequirementOracle;
import com.coursereq.parser.RequirementJsonReader;
import com.coursereq.parser.RequirementJsonReader.ReadResult;
import com.coursereq.repository.CatalogJdbcRepository;
import com.coursereq.repository.RequirementJdbcRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives the oracle over catalog courses and stores every accepted record.
 *
 * <p>A course is sent to the oracle only when it is not blacklisted, carries requirement text, and
 * has no up-to-date stored record. A candidate that fails the schema check is retried with the
 * errors fed back, up to the configured number of attempts.
 */
@Service
public class RequirementImportService {
    private static final Logger log = LoggerFactory.getLogger(RequirementImportService.class);

    private final RequirementJsonReader reader;
    private final RequirementJdbcRepository requirementRepository;
    private final CatalogJdbcRepository catalogRepository;
    private final RequirementOracle oracle;
    private final ReparsePolicy reparsePolicy;
    private final CourseGraphService graphService;
    private final int maxAttempts;
    private final boolean blacklistOnAmbiguity;

    public RequirementImportService(RequirementJsonReader reader,
                                    RequirementJdbcRepository requirementRepository,
                                    CatalogJdbcRepository catalogRepository,
                                    RequirementOracle oracle,
                                    ReparsePolicy reparsePolicy,
                                    CourseGraphService graphService,
                                    @Value("${requirements.oracle.max-attempts:2}") int maxAttempts,
                                    @Value("${requirements.blacklist-on-ambiguity:true}") boolean blacklistOnAmbiguity) {
        this.reader = reader;
        this.requirementRepository = requirementRepository;
        this.catalogRepository = catalogRepository;
        this.oracle = oracle;
        this.reparsePolicy = reparsePolicy;
        this.graphService = graphService;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.blacklistOnAmbiguity = blacklistOnAmbiguity;
    }

    /**
     * Validate a candidate produced elsewhere for {@code course} and store it when it passes.
     */
    public ImportResult importCandidate(CatalogCourse course, JsonNode candidate) {
        List<String> courseErrors = courseErrors(course);
        if (!courseErrors.isEmpty()) {
            log.warn("Rejected candidate for an incomplete catalog course: {}", courseErrors);
            return new ImportResult(ImportStatus.REJECTED, null, 0, courseErrors, null);
        }
        ReadResult read = reader.read(candidate);
        if (!read.isValid()) {
            log.warn("Rejected candidate for {}: {} schema error(s)", course.courseId(), read.errors().size());
            read.errors().forEach(e -> log.debug("  {}", e));
            return new ImportResult(ImportStatus.REJECTED, course.courseId(), 0, read.errors(), null);
        }
        List<String> mismatch = identityErrors(course, read.requirements());
        if (!mismatch.isEmpty()) {
            return new ImportResult(ImportStatus.REJECTED, course.courseId(), 0, mismatch, null);
        }
        store(course, read.requirements());
        return new ImportResult(ImportStatus.STORED, course.courseId(), 0, List.of(), null);
    }

    public ImportResult processCourse(CatalogCourse course) {
        String courseId = course.courseId();

        var blacklisted = catalogRepository.findBlacklisted(course.department(), course.number());
        if (blacklisted.isPresent()) {
            log.info("{}: skipping (blacklisted: {})", courseId, blacklisted.get().reason());
            return ImportResult.skipped(ImportStatus.SKIPPED_BLACKLISTED, courseId);
        }
        if (!course.hasRequirementText()) {
            log.info("{}: skipping (no requirements)", courseId);
            return ImportResult.skipped(ImportStatus.SKIPPED_NO_REQUIREMENTS, courseId);
        }

        Optional<StoredCourseRequirements> existing = requirementRepository.find(course.department(), course.number());
        if (existing.isPresent() && !reparsePolicy.needsReparsing(course, existing.get())) {
            log.debug("{}: skipping (already up to date)", courseId);
            return ImportResult.skipped(ImportStatus.SKIPPED_UP_TO_DATE, courseId);
        }
        log.info("{}: {}", courseId, existing.isPresent() ? "reparsing (source text or schema changed)" : "parsing for the first time");

        List<String> feedback = List.of();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            OracleResponse response = oracle.translate(course, feedback);

            switch (response.kind()) {
                case AMBIGUOUS -> {
                    requirementRepository.recordAttempt(course.department(), course.number(), attempt, "AMBIGUOUS", response.reason());
                    log.warn("{}: ambiguous requirement text: {}", courseId, response.reason());
                    if (blacklistOnAmbiguity) {
                        catalogRepository.addToBlacklist(course.department(), course.number(), "Ambiguity issue: " + response.reason());
                        return new ImportResult(ImportStatus.BLACKLISTED, courseId, attempt, List.of(), response.reason());
                    }
                    return new ImportResult(ImportStatus.FAILED, courseId, attempt, List.of(), response.reason());
                }
                case FAILURE -> {
                    requirementRepository.recordAttempt(course.department(), course.number(), attempt, "FAILURE", response.reason());
                    log.warn("{}: oracle failed: {}", courseId, response.reason());
                    return new ImportResult(ImportStatus.FAILED, courseId, attempt, List.of(), response.reason());
                }
                case CANDIDATE -> {
                    ReadResult read = reader.read(response.candidate());
                    List<String> errors = read.isValid() ? identityErrors(course, read.requirements()) : read.errors();
                    if (errors.isEmpty()) {
                        requirementRepository.recordAttempt(course.department(), course.number(), attempt, "STORED", null);
                        store(course, read.requirements());
                        log.info("{}: parsed and saved after {} attempt(s)", courseId, attempt);
                        return new ImportResult(ImportStatus.STORED, courseId, attempt, List.of(), null);
                    }
                    requirementRepository.recordAttempt(course.department(), course.number(), attempt, "SCHEMA_INVALID",
                            String.join("; ", errors));
                    log.warn("{}: attempt {} failed schema validation with {} error(s)", courseId, attempt, errors.size());
                    errors.forEach(e -> log.debug("  {}", e));
                    feedback = errors;
                }
            }
        }
        return new ImportResult(ImportStatus.FAILED, courseId, maxAttempts, feedback,
                "Schema validation failed after " + maxAttempts + " attempt(s)");
    }

    public BatchSummary processCatalog() {
        List<CatalogCourse> catalog = catalogRepository.loadCatalog();
        log.info("Processing {} catalog courses", catalog.size());

        List<ImportResult> results = new ArrayList<>();
        Map<ImportStatus, Long> counts = new EnumMap<>(ImportStatus.class);
        for (int i = 0; i < catalog.size(); i++) {
            CatalogCourse course = catalog.get(i);
            log.debug("[{}/{}] {}", i + 1, catalog.size(), course.courseId());
            ImportResult result = processCourse(course);
            results.add(result);
            counts.merge(result.status(), 1L, Long::sum);
        }
        log.info("Catalog processing done: {}", counts);
        return new BatchSummary(counts, results);
    }

    public boolean blacklist(String department, String number, String reason) {
        boolean added = catalogRepository.addToBlacklist(department, number, reason);
        if (added) {
            log.info("Added {} {} to blacklist: {}", department, number, reason);
        } else {
            log.warn("{} {} is already blacklisted", department, number);
        }
        return added;
    }

    private void store(CatalogCourse course, ParsedCourseRequirements requirements) {
        requirementRepository.save(StoredCourseRequirements.of(requirements, course, Instant.now()));
        graphService.invalidate();
    }

    private static List<String> courseErrors(CatalogCourse course) {
        if (course == null) return List.of("course: Must be an object");
        List<String> errors = new ArrayList<>();
        if (course.department() == null) errors.add("course.department: Must be a string");
        if (course.number() == null) errors.add("course.number: Must be a string");
        return errors;
    }

    private List<String> identityErrors(CatalogCourse course, ParsedCourseRequirements requirements) {
        List<String> errors = new ArrayList<>();
        if (!Objects.equals(course.department(), requirements.department())) {
            errors.add("department: Expected '" + course.department() + "', got '" + requirements.department() + "'");
        }
        if (!Objects.equals(course.number(), requirements.number())) {
            errors.add("number: Expected '" + course.number() + "', got '" + requirements.number() + "'");
        }
        if (!Objects.equals(reparsePolicy.schemaVersion(), requirements.schemaVersion())) {
            errors.add("schema_version: Expected '" + reparsePolicy.schemaVersion() + "', got '" + requirements.schemaVersion() + "'");
        }
        return errors;
    }

    public enum ImportStatus {
        STORED, REJECTED, FAILED, BLACKLISTED,
        SKIPPED_BLACKLISTED, SKIPPED_NO_REQUIREMENTS, SKIPPED_UP_TO_DATE
    }

    public record ImportResult(ImportStatus status, String courseId, int attempts, List<String> errors, String reason) {
        public ImportResult {
            errors = List.copyOf(errors);
        }

        static ImportResult skipped(ImportStatus status, String courseId) {
            return new ImportResult(status, courseId, 0, List.of(), null);
        }
    }

    public record BatchSummary(Map<ImportStatus, Long> counts, List<ImportResult> results) {}
}
