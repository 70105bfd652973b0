package com.coursereq.repository;

import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementStorageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class RequirementJdbcRepository {
    private static final String COLUMNS =
            "dept, course_number, requirements_json, original_title, original_prerequisites, original_corequisites, original_notes, parsed_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public RequirementJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Insert or replace the record for a course. A replaced record keeps its listing position.
     */
    @Transactional
    public void save(StoredCourseRequirements stored) {
        ParsedCourseRequirements req = stored.requirements();
        String json = toJson(req);
        int updated = jdbcTemplate.update(
                "UPDATE course_requirements SET schema_version=?, requirements_json=?, original_title=?, original_prerequisites=?, " +
                        "original_corequisites=?, original_notes=?, parsed_at=? WHERE dept=? AND course_number=?",
                req.schemaVersion(), json, stored.originalTitle(), stored.originalPrerequisites(),
                stored.originalCorequisites(), stored.originalNotes(), stored.timestamp().toString(),
                req.department(), req.number());
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO course_requirements(dept, course_number, schema_version, requirements_json, original_title, " +
                            "original_prerequisites, original_corequisites, original_notes, parsed_at) VALUES (?,?,?,?,?,?,?,?,?)",
                    req.department(), req.number(), req.schemaVersion(), json, stored.originalTitle(),
                    stored.originalPrerequisites(), stored.originalCorequisites(), stored.originalNotes(),
                    stored.timestamp().toString());
        }
    }

    public Optional<StoredCourseRequirements> find(String department, String number) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_requirements WHERE dept=? AND course_number=?",
                rowMapper(), department, number).stream().findFirst();
    }

    public List<StoredCourseRequirements> loadAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM course_requirements ORDER BY listing_order", rowMapper());
    }

    public void recordAttempt(String department, String number, int attempt, String outcome, String detail) {
        jdbcTemplate.update(
                "INSERT INTO parse_attempts(dept, course_number, attempt, outcome, detail, ts) VALUES (?,?,?,?,?,?)",
                department, number, attempt, outcome, detail, Instant.now().toString());
    }

    public List<AttemptRow> loadAttempts(String department, String number) {
        return jdbcTemplate.query(
                "SELECT dept, course_number, attempt, outcome, detail FROM parse_attempts WHERE dept=? AND course_number=? ORDER BY id",
                (rs, n) -> new AttemptRow(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getString(4), rs.getString(5)),
                department, number);
    }

    public List<String> loadAttemptedCourseIds() {
        return jdbcTemplate.query(
                "SELECT DISTINCT dept, course_number FROM parse_attempts",
                (rs, n) -> rs.getString(1) + " " + rs.getString(2));
    }

    private RowMapper<StoredCourseRequirements> rowMapper() {
        return (rs, rowNum) -> new StoredCourseRequirements(
                fromJson(rs.getString(3), rs.getString(1), rs.getString(2)),
                rs.getString(4),
                rs.getString(5),
                rs.getString(6),
                rs.getString(7),
                Instant.parse(rs.getString(8)));
    }

    private String toJson(ParsedCourseRequirements requirements) {
        try {
            return objectMapper.writeValueAsString(requirements);
        } catch (JsonProcessingException e) {
            throw new RequirementStorageException("Cannot serialize requirements for " + requirements.courseId(), e,
                    Map.of("course", requirements.courseId()));
        }
    }

    private ParsedCourseRequirements fromJson(String json, String department, String number) {
        try {
            return objectMapper.readValue(json, ParsedCourseRequirements.class);
        } catch (JsonProcessingException e) {
            throw new RequirementStorageException("Stored requirements for " + department + " " + number + " are unreadable", e,
                    Map.of("course", department + " " + number));
        }
    }

    public record AttemptRow(String department, String number, int attempt, String outcome, String detail) {}
}
